package nl.nfi.cfgengine.common.ini;

import java.util.List;
import java.util.Set;

public final class IniSection {

    private final IniConfig iniConfig;
    private final String section;

    private IniSection(final IniConfig iniConfig, final String section) {
        this.iniConfig = iniConfig;
        this.section = section;
    }

    static IniSection ofConfig(final IniConfig iniConfig, final String section) {
        return new IniSection(iniConfig, section);
    }

    public String name() {
        return section;
    }

    public Set<String> keys() {
        return iniConfig.keys(section);
    }

    public boolean hasKey(final String key) {
        return iniConfig.hasKey(section, key);
    }

    public String getString(final String key) {
        return iniConfig.getString(section, key);
    }

    public List<String> getStringList(final String key) {
        return iniConfig.getStringList(section, key);
    }

    public List<Double> getDoubleList(final String key) {
        return iniConfig.getDoubleList(section, key);
    }
}
