package tech.authkit.role;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link RoleMapper} that parses the identity bytes as a JSON object and
 * derives the role from its claims.
 *
 * <pre>{@code
 * RoleMapper<DefaultRole> mapper = JsonClaimsRoleMapper.of(claims ->
 *     claims.path("email").asText("").endsWith("@example.com") ? DefaultRole.ADMIN : DefaultRole.USER);
 * }</pre>
 *
 * Payloads that are not JSON objects map to no role. So does a claims function returning {@code null}.
 */
public class JsonClaimsRoleMapper<R> implements RoleMapper<R> {

    private static final Logger LOG = Logger.getLogger(JsonClaimsRoleMapper.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Function<JsonNode, R> claimsMapper;

    public JsonClaimsRoleMapper(Function<JsonNode, R> claimsMapper) {
        this.claimsMapper = claimsMapper;
    }

    public static <R> JsonClaimsRoleMapper<R> of(Function<JsonNode, R> claimsMapper) {
        return new JsonClaimsRoleMapper<>(claimsMapper);
    }

    @Override
    public Optional<R> map(byte[] identity) {
        JsonNode claims;
        try {
            claims = MAPPER.readTree(identity);
        } catch (IOException e) {
            LOG.debugf("Identity payload is not JSON: %s", e.getMessage());
            return Optional.empty();
        }
        if (claims == null || !claims.isObject()) {
            return Optional.empty();
        }
        return Optional.ofNullable(claimsMapper.apply(claims));
    }
}
