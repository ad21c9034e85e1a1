package com.healthrelay.core.model;

import com.healthrelay.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertDefinitionTest {
    @Test
    void unsetFieldsAreTakenFromDefaultAlert() {
        AlertDefinition defaults = new AlertDefinition(
                "from defaults", true, 5, 4, true, Map.of("default-severity", "warning"));
        AlertDefinition alert = new AlertDefinition(null, null, 0, 1, false, null);

        AlertDefinition merged = alert.withDefaults(defaults);

        assertEquals("from defaults", merged.description());
        assertTrue(merged.isEnabled());
        assertEquals(5, merged.failureThresholdOrDefault());
        assertEquals(1, merged.successThresholdOrDefault());
        assertFalse(merged.isSendOnResolved());
        assertEquals("warning", merged.providerOverride().get("default-severity"));
    }

    @Test
    void missingDefaultAlertLeavesAlertUnchanged() {
        AlertDefinition alert = AlertDefinition.withDescription("x");
        assertSame(alert, alert.withDefaults(null));
    }

    @Test
    void fallbacksApplyWhenNothingIsSet() {
        AlertDefinition alert = AlertDefinition.empty();

        assertFalse(alert.isEnabled());
        assertFalse(alert.isSendOnResolved());
        assertEquals(AlertDefinition.DEFAULT_FAILURE_THRESHOLD, alert.failureThresholdOrDefault());
        assertEquals(AlertDefinition.DEFAULT_SUCCESS_THRESHOLD, alert.successThresholdOrDefault());
        assertEquals("", alert.descriptionOrEmpty());
        assertFalse(alert.hasProviderOverride());
        assertEquals(0, alert.providerOverrideAsBytes().length);
    }

    @Test
    void providerOverrideRendersAsYaml() {
        AlertDefinition alert = AlertDefinition.empty()
                .withProviderOverride(Map.of("url", "http://other:9093"));

        String yaml = new String(alert.providerOverrideAsBytes(), StandardCharsets.UTF_8);

        assertTrue(yaml.contains("url: \"http://other:9093\"") || yaml.contains("url: http://other:9093"));
    }

    @Test
    void deserializesKebabCaseKeys() throws Exception {
        AlertDefinition alert = JsonUtils.yamlMapper().readValue("""
                description: disk filling up
                failure-threshold: 4
                send-on-resolved: true
                provider-override:
                  default-severity: info
                """, AlertDefinition.class);

        assertEquals("disk filling up", alert.description());
        assertEquals(4, alert.failureThresholdOrDefault());
        assertTrue(alert.isSendOnResolved());
        assertNull(alert.enabled());
        assertEquals("info", alert.providerOverride().get("default-severity"));
    }

    @Test
    void endpointAndCheckResultNormalizeOptionalFields() {
        Endpoint endpoint = new Endpoint("API", null, "https://api/health");
        assertEquals("", endpoint.group());
        assertFalse(endpoint.hasGroup());
        assertEquals("API", endpoint.displayName());
        assertEquals("prod/API", new Endpoint("API", "prod", "https://api/health").displayName());

        CheckResult result = new CheckResult(false, 0, null, null);
        assertEquals(List.of(), result.errors());
        assertFalse(result.hasErrors());
        assertTrue(CheckResult.failed(List.of("timeout"), null).hasErrors());
    }
}
