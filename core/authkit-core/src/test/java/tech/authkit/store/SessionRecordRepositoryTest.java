package tech.authkit.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.authkit.test.CourseRole;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionRecordRepositoryTest {

    private InMemoryCredentialStore store;
    private SessionRecordRepository<CourseRole> records;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        records = new SessionRecordRepository<>(store, CourseRole.MODEL);
    }

    @Test
    void save_shouldWriteTokenAndRoleUnderFixedKeys() {
        records.save("tok1", CourseRole.TEACHER);

        assertEquals(Optional.of("tok1"), store.get(SessionRecordRepository.TOKEN_KEY));
        assertEquals(Optional.of("TEACHER"), store.get(SessionRecordRepository.ROLE_KEY));
        assertEquals(Optional.of(CourseRole.TEACHER), records.findRole());
    }

    @Test
    void findToken_shouldIgnoreEmptyToken() {
        store.put(SessionRecordRepository.TOKEN_KEY, "");

        assertTrue(records.findToken().isEmpty());
    }

    @Test
    void findRole_shouldReturnEmpty_forUnknownRole() {
        store.put(SessionRecordRepository.ROLE_KEY, "PRINCIPAL");

        assertTrue(records.findRole().isEmpty());
    }

    @Test
    void clear_shouldEmptyStore() {
        records.save("tok1", CourseRole.STUDENT);

        records.clear();

        assertTrue(store.isEmpty());
    }
}
