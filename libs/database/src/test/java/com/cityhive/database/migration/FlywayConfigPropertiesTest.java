package com.cityhive.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FlywayConfigProperties")
class FlywayConfigPropertiesTest {

    @Test
    @DisplayName("defaults blank locations to classpath:db/migration")
    void defaultsLocations() {
        assertThat(new FlywayConfigProperties(true, null, false).locations())
                .isEqualTo("classpath:db/migration");
        assertThat(new FlywayConfigProperties(true, "  ", false).locations())
                .isEqualTo(FlywayConfigProperties.DEFAULT_LOCATIONS);
    }

    @Test
    @DisplayName("keeps explicit values")
    void keepsExplicitValues() {
        var props = new FlywayConfigProperties(false, "classpath:db/other", true);

        assertThat(props.enabled()).isFalse();
        assertThat(props.locations()).isEqualTo("classpath:db/other");
        assertThat(props.baselineOnMigrate()).isTrue();
    }
}
