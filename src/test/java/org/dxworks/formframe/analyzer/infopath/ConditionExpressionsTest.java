package org.dxworks.formframe.analyzer.infopath;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionExpressionsTest {

    @Test
    void conditionField_SkipsFunctionLibrariesAndCalls() {
        assertEquals("isRoundTrip", ConditionExpressions.conditionField("../my:isRoundTrip = 1"));
        assertEquals("status", ConditionExpressions.conditionField("xdXDocument:get-Role() = 'x' and my:status = 'Open'"));
        assertEquals("items", ConditionExpressions.conditionField("xdMath:Avg(my:items) > 0 or my:total > 5"));
        assertEquals("", ConditionExpressions.conditionField("true()"));
        assertEquals("", ConditionExpressions.conditionField(null));
    }

    @Test
    void conditionValue_FirstContainsLiteral() {
        assertEquals("Approved", ConditionExpressions.conditionValue("contains(my:status, \"Approved\")"));
        assertEquals("", ConditionExpressions.conditionValue("my:status = 'Approved'"));
    }

    @Test
    void sectionField_TriesComparisonsNegationAndBoolean() {
        assertEquals("hasCar", ConditionExpressions.sectionField("my:hasCar = 'true'"));
        assertEquals("kind", ConditionExpressions.sectionField("my:kind != 'none'"));
        assertEquals("needsVisa", ConditionExpressions.sectionField("not(my:needsVisa)"));
        assertEquals("isManager", ConditionExpressions.sectionField("boolean(my:isManager)"));
        assertNull(ConditionExpressions.sectionField(""));
    }

    @Test
    void referencesParentContext_DetectsParentSteps() {
        assertTrue(ConditionExpressions.referencesParentContext("../my:isRoundTrip = 1"));
        assertFalse(ConditionExpressions.referencesParentContext("my:isRoundTrip = 1"));
    }

    @Test
    void toReadableFieldName_StripsBooleanPrefixes() {
        assertEquals("Round Trip", ConditionExpressions.toReadableFieldName("isRoundTrip"));
        assertEquals("Manager Approval", ConditionExpressions.toReadableFieldName("hasManagerApproval"));
        assertEquals("Island", ConditionExpressions.toReadableFieldName("island"));
    }
}
