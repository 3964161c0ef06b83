package com.visionai.gateway.database.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabasePropertiesTest {

    @Test
    void shouldListEveryMissingRequiredKey() {
        DatabaseProperties props = new DatabaseProperties();
        props.getServices().put("strategy", new DatabaseTarget("mongodb://db:27017", "strategy"));
        props.getServices().put("assets", new DatabaseTarget("mongodb://db:27017", " "));

        assertThatThrownBy(props::requireComplete)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("agentgw.database.services.assets.name")
                .hasMessageContaining("agentgw.database.services.usage")
                .hasMessageContaining("agentgw.database.services.eventStore")
                .hasMessageNotContaining("services.strategy");
    }

    @Test
    void shouldAcceptCompleteConfiguration() {
        DatabaseProperties props = new DatabaseProperties();
        props.setRequiredServices(List.of("strategy", "usage"));
        props.getServices().put("strategy", new DatabaseTarget("mongodb://db:27017", "strategy"));
        props.getServices().put("usage", new DatabaseTarget("mongodb://db:27017", "usage"));

        assertThatCode(props::requireComplete).doesNotThrowAnyException();
    }

    @Test
    void shouldSkipBlankOptionalServices() {
        DatabaseProperties props = new DatabaseProperties();
        props.setRequiredServices(List.of("strategy"));
        props.getServices().put("strategy", new DatabaseTarget("mongodb://db:27017", "strategy"));
        props.getServices().put("usage", new DatabaseTarget("", ""));

        assertThatCode(props::requireComplete).doesNotThrowAnyException();
        assertThat(props.completeServices()).containsOnlyKeys("strategy");
    }
}
