package uk.gegc.gatekeeper.features.catalog.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionDefinition and PermissionScope")
class PermissionDefinitionTest {

    @Test
    @DisplayName("constructor: declared scope contradicting the suffix is rejected")
    void constructor_scopeMismatch_rejected() {
        assertThatThrownBy(() -> new PermissionDefinition("campaigns.read.own", "campaigns", "read", PermissionScope.TEAM))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("implies own");
    }

    @Test
    @DisplayName("constructor: unsuffixed name may declare scope all")
    void constructor_unsuffixedAll_accepted() {
        PermissionDefinition definition = new PermissionDefinition("analytics.export", "analytics", "export", PermissionScope.ALL);

        assertThat(definition.scope()).isEqualTo(PermissionScope.ALL);
    }

    @Test
    @DisplayName("fromTag: blank is none, unknown tag is rejected")
    void fromTag_blankAndUnknown() {
        assertThat(PermissionScope.fromTag(" ")).isEqualTo(PermissionScope.NONE);
        assertThat(PermissionScope.fromTag("TEAM")).isEqualTo(PermissionScope.TEAM);
        assertThatThrownBy(() -> PermissionScope.fromTag("global"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
