package domain.formula;

import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine identifier -> original identifier, scoped to one request.
 *
 * <p>Entries are only ever added. Two different originals claiming the same engine identifier is an
 * invariant violation and is reported, never masked.</p>
 */
public final class RenameLedger {

    // key = engine identifier
    private final Map<String, String> originalByEngine = new LinkedHashMap<>();
    // key = original identifier
    private final Map<String, String> engineByOriginal = new HashMap<>();

    void record(String engineName, String originalName) {
        String prev = originalByEngine.get(engineName);
        if (prev != null && !prev.equals(originalName)) {
            throw new Ancombc2Exception(ErrorCode.IDENTIFIER_COLLISION,
                    "The metadata columns \"" + prev + "\" and \"" + originalName
                            + "\" both translate to the engine identifier \"" + engineName
                            + "\". Rename one of them so that they stay distinct.");
        }
        originalByEngine.put(engineName, originalName);
        engineByOriginal.put(originalName, engineName);
    }

    /**
     * @return the original name, or null when the engine identifier was never recorded
     */
    public String originalOf(String engineName) {
        return originalByEngine.get(engineName);
    }

    /**
     * @return the engine identifier, or null when the original was never encoded
     */
    public String engineOf(String originalName) {
        return engineByOriginal.get(originalName);
    }

    public boolean isRenamed(String originalName) {
        String e = engineByOriginal.get(originalName);
        return e != null && !e.equals(originalName);
    }

    /**
     * Engine identifiers, longest first (ties in recording order).
     */
    public List<String> engineNamesLongestFirst() {
        List<String> names = new ArrayList<>(originalByEngine.keySet());
        names.sort(Comparator.comparingInt(String::length).reversed());
        return names;
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(originalByEngine));
    }

    public int size() {
        return originalByEngine.size();
    }
}
