package me.golemcore.relay.security;

import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AllowlistValidatorTest {

    private static final String USER_1 = "111";
    private static final String USER_ANY = "999";

    private RelayProperties properties;
    private AllowlistValidator validator;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        validator = new AllowlistValidator(properties);
    }

    // ==================== isAllowed() ====================

    @Test
    void shouldAllowEveryoneWhenAllowlistEmpty() {
        assertTrue(validator.isAllowed(USER_ANY));
    }

    @Test
    void shouldAllowListedUser() {
        properties.getTelegram().setAllowFrom(List.of(USER_1, "222"));

        assertTrue(validator.isAllowed("222"));
    }

    @Test
    void shouldDenyUnlistedUser() {
        properties.getTelegram().setAllowFrom(List.of(USER_1));

        assertFalse(validator.isAllowed(USER_ANY));
    }

    @Test
    void shouldAllowEveryoneWhenAllowlistNull() {
        properties.getTelegram().setAllowFrom(null);

        assertTrue(validator.isAllowed(USER_ANY));
    }

    // ==================== isAdmin() ====================

    @Test
    void shouldHaveNoAdminsWhenListEmpty() {
        assertFalse(validator.isAdmin(USER_1));
    }

    @Test
    void shouldRecognizeConfiguredAdmin() {
        properties.getSecurity().setAdminUsers(List.of(USER_1));

        assertTrue(validator.isAdmin(USER_1));
        assertFalse(validator.isAdmin(USER_ANY));
        assertFalse(validator.isAdmin(null));
    }
}
