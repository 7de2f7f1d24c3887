package org.dxworks.formframe.model.infopath;

import org.dxworks.formframe.model.Analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FormAnalysis implements Analysis {
    public String formPath;
    public String format = "infopath";
    public List<ViewModel> views = new ArrayList<>();
    public List<DynamicSection> dynamicSections = new ArrayList<>();
    public Map<String, List<String>> conditionalVisibility = new LinkedHashMap<>();
    public List<DataColumn> data = new ArrayList<>();
    public FormMetadata metadata = new FormMetadata();
    public List<AnalysisMessage> messages = new ArrayList<>();

    @Override
    public String getFormPath() {
        return formPath;
    }

    @Override
    public String getFormat() {
        return format;
    }
}
