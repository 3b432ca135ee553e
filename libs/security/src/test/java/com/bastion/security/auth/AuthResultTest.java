package com.bastion.security.auth;

import com.bastion.security.testing.TestIdentityFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthResult")
class AuthResultTest {

    @Test
    @DisplayName("a grant carries the identity and an optional token")
    void granted() {
        var granted = new AuthResult.Granted(TestIdentityFactory.user(), null);

        assertThat(granted.isGranted()).isTrue();
        assertThat(granted.sessionToken()).isEmpty();
        assertThat(granted.withToken("abc").sessionToken()).contains("abc");
        assertThat(granted.orElseThrow()).isSameAs(granted);
    }

    @ParameterizedTest
    @EnumSource(AuthFailure.class)
    @DisplayName("a denial throws the typed exception with the failure's message")
    void denied(AuthFailure failure) {
        var denied = new AuthResult.Denied(failure);

        assertThat(denied.isGranted()).isFalse();
        assertThatThrownBy(denied::orElseThrow)
                .isInstanceOf(AuthenticationException.class)
                .hasMessage(failure.message())
                .satisfies(e -> assertThat(((AuthenticationException) e).failure()).isEqualTo(failure));
    }
}
