package org.dxworks.formframe.model.infopath;

import java.util.ArrayList;
import java.util.List;

public class ViewModel {
    public String viewName;
    public List<Control> controls = new ArrayList<>();
    public List<SectionScope> sections = new ArrayList<>();
    public String loadError; // nullable, set when the document could not be read
    public String parseError; // nullable, set when the loaded document could not be walked
}
