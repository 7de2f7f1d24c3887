package org.dxworks.formframe.model.infopath;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Control {
    public String name;
    public ControlKind kind;
    public String type; // kind display name, "ActiveX-{classid}" or the raw element name for Other
    public String label;
    public String binding;
    public int docIndex; // capture order, strictly increasing within a view
    public GridPosition gridPosition; // set once at capture
    public int columnSpan = 1;
    public int rowSpan = 1;
    public String parentSection;
    public SectionKind sectionType;
    public boolean inRepeatingSection;
    public String repeatingSectionName;
    public String repeatingSectionBinding;
    public boolean mergedIntoParent;
    public boolean multiLineLabel;
    public String associatedLabelId;
    public String associatedControlId;
    public ControlOrigin origin = ControlOrigin.MAIN;
    public Map<String, String> properties = new LinkedHashMap<>();
    public List<ChoiceOption> choiceOptions = new ArrayList<>();

    @JsonIgnore
    public String getCtrlId() {
        return properties.get("CtrlId");
    }

    public boolean hasChoiceOptions() {
        return choiceOptions != null && !choiceOptions.isEmpty();
    }
}
