package tech.authkit.role;

/**
 * Ready-made roles for applications that only distinguish administrators,
 * regular users and guests.
 */
public enum DefaultRole {
    ADMIN,
    USER,
    GUEST;

    public static final RoleModel<DefaultRole> MODEL = EnumRoleModel.of(DefaultRole.class, GUEST);
}
