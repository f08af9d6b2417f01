package com.example.offshore.allocation.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.offshore.allocation.model.Department;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FallbackClassifier")
class FallbackClassifierTest {

    private final FallbackClassifier classifier = new FallbackClassifier(new LocationNormalizer());

    @Test
    @DisplayName("Thunder Horse with drilling activity is Drilling")
    void thunderHorseDrilling() {
        assertThat(classifier.classify("Thunder Horse", "Drill Support", "Positioning", "Drilling operations", null))
                .isEqualTo(Department.DRILLING);
    }

    @Test
    @DisplayName("Thunder Horse without drilling activity is Production")
    void thunderHorseProduction() {
        assertThat(classifier.classify("Thunder Horse", "Production Support", "Maintenance", "Production platform", null))
                .isEqualTo(Department.PRODUCTION);
    }

    @Test
    @DisplayName("Mad Dog follows the same rule")
    void madDog() {
        assertThat(classifier.classify("Mad Dog", "Cargo Ops", "Offload", "drill pipe", null))
                .isEqualTo(Department.DRILLING);
        assertThat(classifier.classify("Mad Dog", "Cargo Ops", "Offload", "chemicals", null))
                .isEqualTo(Department.PRODUCTION);
    }

    @Test
    @DisplayName("Rig port type is Drilling")
    void rigPortType() {
        assertThat(classifier.classify("Rig 123", "Support", "Transport", "Equipment transport", "rig"))
                .isEqualTo(Department.DRILLING);
    }

    @Test
    @DisplayName("Cargo work at a supply base is Logistics")
    void supplyBaseCargo() {
        assertThat(classifier.classify("Port Fourchon", "Cargo Operations", "Loading", "Supply run", "base"))
                .isEqualTo(Department.LOGISTICS);
    }

    @Test
    @DisplayName("Supply parent event at a base is Logistics")
    void supplyBaseSupplyParent() {
        assertThat(classifier.classify("Houma Base", "Supply Run", "Steaming", null, null))
                .isEqualTo(Department.LOGISTICS);
    }

    @Test
    @DisplayName("Non-cargo work at a base falls through to the event rules")
    void baseWithoutCargoFallsThrough() {
        assertThat(classifier.classify("Port Fourchon", "Waiting", "Production chemicals", null, "base"))
                .isEqualTo(Department.PRODUCTION);
    }

    @Test
    @DisplayName("Drill and production keywords in events decide")
    void eventKeywords() {
        assertThat(classifier.classify("Somewhere", "Drilling support", "Standby", null, null))
                .isEqualTo(Department.DRILLING);
        assertThat(classifier.classify("Somewhere", "Standby", "Production support", null, null))
                .isEqualTo(Department.PRODUCTION);
    }

    @Test
    @DisplayName("Transport parent event is Logistics")
    void transportParent() {
        assertThat(classifier.classify("Open water", "Transport", "Steaming", null, null))
                .isEqualTo(Department.LOGISTICS);
    }

    @Test
    @DisplayName("Anything else is Operations")
    void defaultsToOperations() {
        assertThat(classifier.classify("Unknown", "General", "Transport", "General operations", null))
                .isEqualTo(Department.OPERATIONS);
        assertThat(classifier.classify(null, null, null, null, null)).isEqualTo(Department.OPERATIONS);
    }

    @Test
    @DisplayName("Same input always yields the same department")
    void isDeterministic() {
        Department first = classifier.classify("Port Fourchon", "Cargo Operations", "Loading", "Supply run", "base");
        for (int i = 0; i < 10; i++) {
            assertThat(classifier.classify("Port Fourchon", "Cargo Operations", "Loading", "Supply run", "base"))
                    .isEqualTo(first);
        }
    }
}
