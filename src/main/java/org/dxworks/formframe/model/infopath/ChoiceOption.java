package org.dxworks.formframe.model.infopath;

public class ChoiceOption {
    public String value;
    public String displayText;
    public boolean isDefault;
    public int order;

    public ChoiceOption() {
    }

    public ChoiceOption(String value, String displayText, boolean isDefault, int order) {
        this.value = value;
        this.displayText = displayText;
        this.isDefault = isDefault;
        this.order = order;
    }

    public ChoiceOption copy() {
        return new ChoiceOption(value, displayText, isDefault, order);
    }
}
