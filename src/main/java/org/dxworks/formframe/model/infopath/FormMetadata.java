package org.dxworks.formframe.model.infopath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class FormMetadata {
    public int viewCount;
    public int totalControls;
    public int totalSections;
    public int dynamicSectionCount;
    public int repeatingSectionCount;
    public List<String> conditionalFields = new ArrayList<>();
    public Map<String, Integer> controlTypes = new TreeMap<>();
}
