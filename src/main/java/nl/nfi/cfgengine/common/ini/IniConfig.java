package nl.nfi.cfgengine.common.ini;

import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.readAllLines;
import static java.util.Collections.unmodifiableSet;

// minimal INI reader:
//      [SECTION]
//      key = value
//      list = ["a", "b"]
// lines starting with ; or # are comments, list values are JSON arrays
public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        if (!hasSection(section)) {
            throw new IllegalArgumentException("INI config does not contain given section: %s".formatted(section));
        }
        return IniSection.ofConfig(this, section);
    }

    public Set<String> keys(final String section) {
        if (!hasSection(section)) {
            throw new IllegalArgumentException("INI config does not contain given section: %s".formatted(section));
        }
        return unmodifiableSet(sections.get(section).keySet());
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public List<String> getStringList(final String section, final String key) {
        final JSONArray array = parseArray(section, key);
        final List<String> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    public List<Double> getDoubleList(final String section, final String key) {
        final JSONArray array = parseArray(section, key);
        final List<Double> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            values.add(array.getDouble(i));
        }
        return values;
    }

    private JSONArray parseArray(final String section, final String key) {
        final String value = getString(section, key);
        try {
            return new JSONArray(value);
        } catch (final JSONException e) {
            throw new IllegalArgumentException("INI value is not a valid list: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }
        return parse(readAllLines(path, UTF_8));
    }

    public static IniConfig parse(final List<String> lines) {
        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        String title = null;
        Map<String, String> section = null;
        for (final String rawLine : lines) {
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                title = line.substring(1, line.length() - 1).strip();
                section = sections.computeIfAbsent(title, name -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI entry outside of any section: %s".formatted(line));
            }
            final int separator = line.indexOf('=');
            final String key = separator < 0 ? line : line.substring(0, separator).strip();
            final String value = separator < 0 ? "" : line.substring(separator + 1).strip();
            if (section.putIfAbsent(key, value) != null) {
                throw new IllegalArgumentException("INI config contains duplicate key in given section: %s -> %s".formatted(title, key));
            }
        }
        return new IniConfig(sections);
    }
}
