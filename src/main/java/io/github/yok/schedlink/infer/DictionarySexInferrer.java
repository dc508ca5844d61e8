package io.github.yok.schedlink.infer;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link SexInferrer} backed by a first-name dictionary loaded from the classpath.
 *
 * <p>
 * The dictionary is a UTF-8 CSV file with the header {@code name,sex,country}. {@code sex} is one of
 * the codes accepted by {@link InferredSex#fromCode(String)}; {@code country} is an ISO code or
 * {@code *} for any country. Lookups ignore case and accents. An entry for the configured country
 * wins over a {@code *} entry.
 * </p>
 *
 * <p>
 * A dictionary that cannot be read is logged once; the inferrer then answers empty for every name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DictionarySexInferrer implements SexInferrer {

    private static final String ANY_COUNTRY = "*";

    private final Map<String, InferredSex> entries;

    /**
     * Loads the dictionary from the classpath.
     *
     * @param location classpath location of the CSV file
     * @param country ISO country code used to select entries
     */
    public DictionarySexInferrer(String location, String country) {
        this(load(location, country));
    }

    @VisibleForTesting
    DictionarySexInferrer(Map<String, InferredSex> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    @Override
    public Optional<InferredSex> infer(String firstName) {
        if (StringUtils.isBlank(firstName)) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key(firstName)));
    }

    /**
     * Returns the number of names known to this inferrer.
     *
     * @return dictionary size
     */
    public int size() {
        return entries.size();
    }

    static String key(String name) {
        return StringUtils.stripAccents(name.trim()).toUpperCase(Locale.ROOT);
    }

    private static Map<String, InferredSex> load(String location, String country) {
        ClassLoader loader = DictionarySexInferrer.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(location)) {
            if (in == null) {
                log.warn("Name dictionary not found on classpath: {} → sex inference disabled",
                        location);
                return new HashMap<>();
            }
            Map<String, InferredSex> result =
                    parse(new InputStreamReader(in, StandardCharsets.UTF_8), country);
            log.info("Name dictionary loaded: {} ({} names, country={})", location, result.size(),
                    country);
            return result;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read name dictionary {}: {} → sex inference disabled", location,
                    e.getMessage(), e);
            return new HashMap<>();
        }
    }

    @VisibleForTesting
    static Map<String, InferredSex> parse(Reader reader, String country) throws IOException {
        String wanted = StringUtils.defaultString(country).trim().toUpperCase(Locale.ROOT);
        Map<String, InferredSex> generic = new HashMap<>();
        Map<String, InferredSex> specific = new HashMap<>();

        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true).setTrim(true).setCommentMarker('#').build();
        try (CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                if (!record.isConsistent()) {
                    log.debug("Skipping malformed dictionary line {}", record.getRecordNumber());
                    continue;
                }
                String name = record.get("name");
                Optional<InferredSex> sex = InferredSex.fromCode(record.get("sex"));
                if (StringUtils.isBlank(name) || sex.isEmpty()) {
                    log.debug("Skipping dictionary line {}: {}", record.getRecordNumber(), record);
                    continue;
                }
                String recordCountry = record.get("country").toUpperCase(Locale.ROOT);
                if (ANY_COUNTRY.equals(recordCountry)) {
                    generic.put(key(name), sex.get());
                } else if (recordCountry.equals(wanted)) {
                    specific.put(key(name), sex.get());
                }
            }
        }
        generic.putAll(specific);
        return generic;
    }
}
