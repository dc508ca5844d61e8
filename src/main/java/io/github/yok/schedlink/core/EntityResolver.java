package io.github.yok.schedlink.core;

import io.github.yok.schedlink.infer.InferredSex;
import io.github.yok.schedlink.infer.SexInferrer;
import io.github.yok.schedlink.util.NameNormalizer;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Finds or creates patient and service rows in the destination, deduplicating within one run.
 *
 * <p>
 * Each entity kind has a key → id cache. A hit returns without any database access. A miss looks
 * the key up in the destination and inserts a row when it is not there. Caches are unbounded and
 * live as long as the resolver; create one resolver per run and drop it afterwards, because ids
 * from an earlier run are meaningless once the destination has been rebuilt.
 * </p>
 *
 * <p>
 * Not thread-safe. All statements run on the connection given at construction, inside the
 * caller's transaction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class EntityResolver {

    static final String SELECT_PATIENT = "SELECT id FROM patient WHERE identity_document = ?";
    static final String INSERT_PATIENT = "INSERT INTO patient "
            + "(given_name, family_name, identity_document, inferred_sex) VALUES (?, ?, ?, ?)";
    static final String SELECT_SERVICE = "SELECT id FROM service WHERE name = ?";
    static final String INSERT_SERVICE = "INSERT INTO service (name) VALUES (?)";

    private final Connection connection;
    private final SexInferrer sexInferrer;

    // identity document (trimmed) → patient.id
    private final Map<String, Long> patientCache = new HashMap<>();
    // service name (trimmed) → service.id
    private final Map<String, Long> serviceCache = new HashMap<>();

    private int patientsCreated;
    private int servicesCreated;

    /**
     * Creates a resolver for one run.
     *
     * @param connection destination connection
     * @param sexInferrer first-name sex inference
     */
    public EntityResolver(Connection connection, SexInferrer sexInferrer) {
        this.connection = connection;
        this.sexInferrer = sexInferrer;
    }

    /**
     * Returns the id of the patient with the given identity document, creating the row if needed.
     *
     * @param identityDocument identity document; only surrounding whitespace is removed
     * @param rawGivenName given name as read from the source
     * @param rawFamilyName family name as read from the source
     * @return patient id
     * @throws SQLException on lookup or insert failure
     */
    public long resolveSubject(String identityDocument, String rawGivenName,
            String rawFamilyName) throws SQLException {
        String document = StringUtils.trimToEmpty(identityDocument);

        Long cached = patientCache.get(document);
        if (cached != null) {
            return cached;
        }

        Optional<Long> existing = findId(SELECT_PATIENT, document);
        if (existing.isPresent()) {
            patientCache.put(document, existing.get());
            return existing.get();
        }

        String givenName = NameNormalizer.normalize(rawGivenName);
        String familyName = NameNormalizer.normalize(rawFamilyName);
        String sex = inferSex(NameNormalizer.firstToken(givenName));

        long id = insert(INSERT_PATIENT, "patient", givenName, familyName, document, sex);
        patientCache.put(document, id);
        patientsCreated++;
        return id;
    }

    /**
     * Returns the id of the service with the given name, creating the row if needed.
     *
     * @param rawServiceName service name; only surrounding whitespace is removed
     * @return service id
     * @throws SQLException on lookup or insert failure
     */
    public long resolveService(String rawServiceName) throws SQLException {
        String name = StringUtils.trimToEmpty(rawServiceName);

        Long cached = serviceCache.get(name);
        if (cached != null) {
            return cached;
        }

        Optional<Long> existing = findId(SELECT_SERVICE, name);
        if (existing.isPresent()) {
            serviceCache.put(name, existing.get());
            return existing.get();
        }

        long id = insert(INSERT_SERVICE, "service", name);
        serviceCache.put(name, id);
        servicesCreated++;
        return id;
    }

    /**
     * Returns the number of patient rows inserted by this resolver.
     *
     * @return created patient count
     */
    public int getPatientsCreated() {
        return patientsCreated;
    }

    /**
     * Returns the number of service rows inserted by this resolver.
     *
     * @return created service count
     */
    public int getServicesCreated() {
        return servicesCreated;
    }

    private String inferSex(String firstName) {
        if (firstName.isEmpty()) {
            return null;
        }
        try {
            return sexInferrer.infer(firstName).map(InferredSex::name).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Sex inference failed for '{}': {} → stored as NULL", firstName,
                    e.getMessage());
            return null;
        }
    }

    private Optional<Long> findId(String sql, String key) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private long insert(String sql, String table, String... values) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"})) {
            for (int i = 0; i < values.length; i++) {
                ps.setString(i + 1, values[i]);
            }
            ps.executeUpdate();
            return GeneratedKeys.single(ps, table);
        }
    }
}
