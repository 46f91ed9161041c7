package infra.mapping;

import domain.mapping.MethodCategory;
import domain.mapping.MethodMapping;
import domain.mapping.MethodTarget;

import java.util.Locale;

/**
 * Turns one loaded row (python, javascript, category, direction, note) into a {@link MethodMapping}.
 *
 * <p>A row with a single name, or restricted to one direction, maps the other direction to an
 * unsupported target so the gap is reported instead of silently ignored.</p>
 */
final class MethodMappingRows {

    private MethodMappingRows() {
    }

    /** @return the mapping, or null for an empty row */
    static MethodMapping toMapping(String python, String javascript, String category, String direction, String note) {
        String py = trimToNull(python);
        String js = trimToNull(javascript);
        if (py == null && js == null) return null;

        MethodCategory cat = MethodCategory.parse(category);
        String why = trimToNull(note);
        String dir = normalizeDirection(direction);

        MethodTarget toJs;
        MethodTarget toPy;
        if (py == null) {
            toJs = null;
            toPy = MethodTarget.unsupported(why == null ? "no python equivalent" : why);
        } else if (js == null) {
            toJs = MethodTarget.unsupported(why == null ? "no javascript equivalent" : why);
            toPy = null;
        } else {
            toJs = "topython".equals(dir)
                    ? MethodTarget.unsupported(why == null ? "python only" : why)
                    : MethodTarget.rename(js);
            toPy = "tojavascript".equals(dir)
                    ? MethodTarget.unsupported(why == null ? "javascript only" : why)
                    : MethodTarget.rename(py);
        }
        return new MethodMapping(py, js, cat, toJs, toPy);
    }

    /** "both" (default), "toJavaScript" or "toPython", with common spellings. */
    static String normalizeDirection(String raw) {
        String t = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z>]", "");
        switch (t) {
            case "pythontojavascript":
            case "python>javascript":
            case "py>js":
            case "tojs":
            case "tojavascript":
                return "tojavascript";
            case "javascripttopython":
            case "javascript>python":
            case "js>py":
            case "topy":
            case "topython":
                return "topython";
            default:
                return "both";
        }
    }

    static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
