package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.ChoiceOption;
import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;
import org.dxworks.formframe.model.infopath.DataColumn;
import org.dxworks.formframe.model.infopath.ViewModel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.dxworks.formframe.TestUtils.loadSample;
import static org.junit.jupiter.api.Assertions.*;

public class DataColumnConsolidatorTest {

    private final DataColumnConsolidator consolidator = new DataColumnConsolidator();
    private final ViewStructuralParser parser = new ViewStructuralParser();

    @Test
    void consolidate_SameFieldUnderDifferentRepeatingScopes_StaysTwoColumns() throws Exception {
        ViewModel expenses = parser.parse(loadSample("expenses", "view1.xsl"), "view1.xsl");
        ViewModel trips = parser.parse(loadSample("expenses", "view2.xsl"), "view2.xsl");

        List<DataColumn> columns = consolidator.consolidate(List.of(expenses, trips), Map.of());

        assertEquals(2, columns.size());
        DataColumn mealCategory = columns.get(0);
        assertEquals("Category", mealCategory.columnName);
        assertEquals("Expenses", mealCategory.owningSection);
        assertTrue(mealCategory.repeating);
        assertEquals("my:Expenses/my:Expense", mealCategory.repeatingSectionPath);
        assertEquals("Lodging", mealCategory.defaultValue);
        assertEquals(2, mealCategory.validValues.size());

        DataColumn tripCategory = columns.get(1);
        assertEquals("Category", tripCategory.columnName);
        assertEquals("Trips", tripCategory.owningSection);
        assertEquals("Air", tripCategory.validValues.get(0).value);
        assertNull(tripCategory.defaultValue);
    }

    @Test
    void consolidate_SameFieldInTwoViews_CollapsesAndUnionsOptions() {
        Control first = dropDown("status", "my:status", new ChoiceOption("A", "Alpha", false, 0));
        Control second = dropDown("status", "my:status",
                new ChoiceOption("A", "Alpha", false, 0), new ChoiceOption("B", "Beta", true, 1));
        second.label = "Status";

        List<DataColumn> columns = consolidator.consolidate(List.of(view(first), view(second)), Map.of());

        assertEquals(1, columns.size());
        DataColumn status = columns.get(0);
        assertEquals("Status", status.displayName);
        assertEquals(2, status.validValues.size());
        assertEquals("B", status.validValues.get(1).value);
        assertEquals(1, status.validValues.get(1).order);
        assertEquals("B", status.defaultValue);
    }

    @Test
    void consolidate_NonDataAndMergedControls_AreSkipped() {
        Control label = new Control();
        label.name = "TITLE";
        label.kind = ControlKind.LABEL;
        Control button = new Control();
        button.name = "CTRL9";
        button.kind = ControlKind.BUTTON;
        Control expression = new Control();
        expression.name = "total";
        expression.kind = ControlKind.EXPRESSION_BOX;
        Control merged = new Control();
        merged.name = "SECONDLINE";
        merged.kind = ControlKind.TEXT_FIELD;
        merged.mergedIntoParent = true;

        List<DataColumn> columns = consolidator.consolidate(List.of(view(label, button, expression, merged)), Map.of());

        assertTrue(columns.isEmpty());
    }

    @Test
    void consolidate_ControlInVisibilityMap_IsConditional() {
        Control hotel = new Control();
        hotel.name = "hotel";
        hotel.kind = ControlKind.TEXT_FIELD;
        hotel.type = "TextField";
        hotel.binding = "my:hotel";
        hotel.properties.put("CtrlId", "CTRL51");

        List<DataColumn> columns = consolidator.consolidate(List.of(view(hotel)),
                Map.of("isRoundTrip", List.of("CTRL42", "CTRL51")));

        assertTrue(columns.get(0).conditional);
        assertEquals("isRoundTrip", columns.get(0).conditionalOnField);
    }

    @Test
    void merge_FillsOnlyEmptyFields() {
        DataColumn target = new DataColumn();
        target.columnName = "amount";
        target.type = "TextField";
        DataColumn source = new DataColumn();
        source.columnName = "amount";
        source.type = "RichText";
        source.displayName = "Amount";
        source.conditional = true;
        source.conditionalOnField = "hasAmount";

        DataColumnConsolidator.merge(target, source);

        assertEquals("TextField", target.type);
        assertEquals("Amount", target.displayName);
        assertTrue(target.conditional);
        assertEquals("hasAmount", target.conditionalOnField);
        assertNull(target.validValues);
    }

    private static Control dropDown(String name, String binding, ChoiceOption... options) {
        Control control = new Control();
        control.name = name;
        control.kind = ControlKind.DROP_DOWN;
        control.type = "DropDown";
        control.binding = binding;
        control.choiceOptions = new ArrayList<>(List.of(options));
        return control;
    }

    private static ViewModel view(Control... controls) {
        ViewModel view = new ViewModel();
        view.viewName = "view.xsl";
        view.controls = new ArrayList<>(List.of(controls));
        return view;
    }
}
