package com.threadline.notificationservice.config;

import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RolesJwtAuthenticationConverterTest {

    private final RolesJwtAuthenticationConverter converter = new RolesJwtAuthenticationConverter();

    @Test
    void convert_RolesClaim_MapsToRoleAuthorities() {
        Jwt jwt = Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("3f0c5e9a-2b1d-4c6e-8f7a-9b0c1d2e3f4a")
                .claim(JwtClaims.ROLES, List.of("admin", "sales"))
                .build();

        AbstractAuthenticationToken token = converter.convert(jwt);

        assertThat(token.getName()).isEqualTo("3f0c5e9a-2b1d-4c6e-8f7a-9b0c1d2e3f4a");
        assertThat(token.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("ROLE_ADMIN", "ROLE_SALES");
    }

    @Test
    void convert_NoRolesClaim_NoAuthorities() {
        Jwt jwt = Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("3f0c5e9a-2b1d-4c6e-8f7a-9b0c1d2e3f4a")
                .build();

        assertThat(converter.convert(jwt).getAuthorities()).isEmpty();
    }
}
