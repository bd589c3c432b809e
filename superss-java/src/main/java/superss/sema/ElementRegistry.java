package superss.sema;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Element names a type selector may use without being an alias. Hyphenated names are
 * custom elements and always accepted.
 */
public final class ElementRegistry {
    private static final String RESOURCE = "/superss/html-elements.txt";

    private static ElementRegistry standard;

    // lower-case name -> listed spelling
    private final Map<String, String> names;

    public ElementRegistry(Set<String> names) {
        this.names = new HashMap<>();
        for (String n : names) this.names.put(n.toLowerCase(Locale.ROOT), n);
    }

    /** The bundled HTML and SVG element list. */
    public static synchronized ElementRegistry standard() {
        if (standard == null) standard = new ElementRegistry(load(RESOURCE));
        return standard;
    }

    public boolean isElement(String name) {
        return canonicalName(name) != null;
    }

    /**
     * The spelling to emit for {@code name}: the listed one ({@code DIV} gives {@code div},
     * {@code lineargradient} gives {@code linearGradient}), lower case for a custom element, or
     * null when {@code name} is not an element.
     */
    public String canonicalName(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        String listed = names.get(key);
        if (listed != null) return listed;
        return name.indexOf('-') > 0 ? key : null;
    }

    static Set<String> load(String resource) {
        InputStream in = ElementRegistry.class.getResourceAsStream(resource);
        if (in == null) throw new IllegalStateException("Missing resource " + resource);

        Set<String> out = new HashSet<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                line = line.strip();
                if (!line.isEmpty() && !line.startsWith("#")) out.add(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
        return out;
    }
}
