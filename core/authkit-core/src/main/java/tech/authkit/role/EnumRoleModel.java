package tech.authkit.role;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link RoleModel} for enum role types, persisted by constant name.
 */
public class EnumRoleModel<E extends Enum<E>> implements RoleModel<E> {

    private final Class<E> type;
    private final E guest;

    public EnumRoleModel(Class<E> type, E guest) {
        this.type = Objects.requireNonNull(type, "type");
        this.guest = Objects.requireNonNull(guest, "guest");
    }

    public static <E extends Enum<E>> EnumRoleModel<E> of(Class<E> type, E guest) {
        return new EnumRoleModel<>(type, guest);
    }

    @Override
    public E guest() {
        return guest;
    }

    @Override
    public String serialize(E role) {
        return role.name();
    }

    @Override
    public Optional<E> deserialize(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Enum.valueOf(type, value.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
