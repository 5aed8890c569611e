package com.cityhive.service.domain.creation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CreationResult")
class CreationResultTest {

    @Test
    @DisplayName("success carries only the entity")
    void successCarriesEntity() {
        CreationResult<String> result = CreationResult.success("hive");

        assertThat(result.success()).isTrue();
        assertThat(result.entity()).isEqualTo("hive");
        assertThat(result.errorKind()).isNull();
        assertThat(result.message()).isNull();
    }

    @Test
    @DisplayName("failure carries a kind and a message but no entity")
    void failureCarriesKindAndMessage() {
        CreationResult<String> result = CreationResult.failure(CreationErrorKind.NOT_FOUND, "User not found");

        assertThat(result.success()).isFalse();
        assertThat(result.entity()).isNull();
        assertThat(result.errorKind()).isEqualTo(CreationErrorKind.NOT_FOUND);
        assertThat(result.message()).isEqualTo("User not found");
    }

    @Test
    @DisplayName("rejects mixed arms")
    void rejectsMixedArms() {
        assertThatThrownBy(() -> new CreationResult<>(true, "hive", CreationErrorKind.CONFLICT, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CreationResult<>(false, "hive", CreationErrorKind.CONFLICT, "conflict"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CreationResult.success(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CreationResult.failure(null, "message"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CreationResult.failure(CreationErrorKind.UNKNOWN, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
