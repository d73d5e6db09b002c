package tech.authkit.role;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link RoleModel} that stores roles as JSON via Jackson.
 *
 * <p>Fits record or class role types that carry more than a name, e.g.
 * {@code record CourseRole(String course, Level level)}.
 */
public class JsonRoleModel<R> implements RoleModel<R> {

    private static final Logger LOG = Logger.getLogger(JsonRoleModel.class);

    private final Class<R> type;
    private final R guest;
    private final ObjectMapper objectMapper;

    public JsonRoleModel(Class<R> type, R guest) {
        this(type, guest, new ObjectMapper());
    }

    public JsonRoleModel(Class<R> type, R guest, ObjectMapper objectMapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.guest = Objects.requireNonNull(guest, "guest");
        this.objectMapper = objectMapper;
    }

    @Override
    public R guest() {
        return guest;
    }

    @Override
    public String serialize(R role) {
        try {
            return objectMapper.writeValueAsString(role);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Role cannot be written as JSON: " + role, e);
        }
    }

    @Override
    public Optional<R> deserialize(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(value, type));
        } catch (JsonProcessingException e) {
            LOG.debugf("Stored role is not a valid %s: %s", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
