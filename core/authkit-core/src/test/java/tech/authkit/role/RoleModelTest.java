package tech.authkit.role;

import org.junit.jupiter.api.Test;
import tech.authkit.test.CourseRole;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RoleModelTest {

    record Enrollment(String course, String level) {
    }

    @Test
    void enumModel_shouldRoundTripByName() {
        RoleModel<CourseRole> model = CourseRole.MODEL;

        assertEquals("TEACHER", model.serialize(CourseRole.TEACHER));
        assertEquals(Optional.of(CourseRole.TEACHER), model.deserialize("TEACHER"));
        assertEquals(CourseRole.GUEST, model.guest());
    }

    @Test
    void enumModel_shouldRejectUnknownOrBlankValues() {
        assertTrue(DefaultRole.MODEL.deserialize("SUPERUSER").isEmpty());
        assertTrue(DefaultRole.MODEL.deserialize("").isEmpty());
        assertTrue(DefaultRole.MODEL.deserialize(null).isEmpty());
    }

    @Test
    void jsonModel_shouldRoundTripRecordRoles() {
        var guest = new Enrollment("none", "guest");
        var model = new JsonRoleModel<>(Enrollment.class, guest);
        var role = new Enrollment("cs101", "teacher");

        String stored = model.serialize(role);

        assertEquals(Optional.of(role), model.deserialize(stored));
        assertSame(guest, model.guest());
    }

    @Test
    void jsonModel_shouldReturnEmpty_forCorruptValue() {
        var model = new JsonRoleModel<>(Enrollment.class, new Enrollment("none", "guest"));

        assertTrue(model.deserialize("{not json").isEmpty());
        assertTrue(model.deserialize("   ").isEmpty());
    }
}
