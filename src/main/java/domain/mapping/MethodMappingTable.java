package domain.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static domain.mapping.MethodCategory.ASSOCIATIVE;
import static domain.mapping.MethodCategory.FREE_FUNCTION;
import static domain.mapping.MethodCategory.SEQUENCE;
import static domain.mapping.MethodCategory.TEXT;

/**
 * Built-in method rows. Order matters: see {@link MethodNameMapper}.
 */
public final class MethodMappingTable {

    // receiver: identifier chain, optionally indexed
    private static final String RECV = "([\\w.]+(?:\\[[^\\]]*\\])?)";
    private static final String STR_LITERAL = "(\"[^\"]*\"|'[^']*')";

    private MethodMappingTable() {
    }

    public static List<MethodMapping> builtIn() {
        List<MethodMapping> t = new ArrayList<>(80);

        // text
        t.add(MethodMapping.renamed("upper", "toUpperCase", TEXT));
        t.add(MethodMapping.renamed("lower", "toLowerCase", TEXT));
        t.add(MethodMapping.renamed("strip", "trim", TEXT));
        t.add(MethodMapping.renamed("lstrip", "trimStart", TEXT));
        t.add(MethodMapping.renamed("rstrip", "trimEnd", TEXT));
        t.add(MethodMapping.renamed("replace", "replaceAll", TEXT));
        t.add(MethodMapping.renamed("startswith", "startsWith", TEXT));
        t.add(MethodMapping.renamed("endswith", "endsWith", TEXT));
        t.add(MethodMapping.renamed("find", "indexOf", TEXT));
        t.add(new MethodMapping("join", "join", TEXT,
                MethodTarget.custom("(\"[^\"]*\"|'[^']*'|\\w+)\\.join\\(\\s*([\\w.]+)\\s*\\)", "$2.join($1)"),
                MethodTarget.custom("([\\w.]+)\\.join\\(\\s*" + STR_LITERAL + "\\s*\\)", "$2.join($1)")));
        t.add(new MethodMapping("isdigit", null, TEXT,
                MethodTarget.custom(RECV + "\\.isdigit\\(\\s*\\)", "/^\\\\d+\\$/.test($1)"), null));
        t.add(new MethodMapping("isalpha", null, TEXT,
                MethodTarget.custom(RECV + "\\.isalpha\\(\\s*\\)", "/^[a-zA-Z]+\\$/.test($1)"), null));
        t.add(new MethodMapping(null, "charAt", TEXT,
                null, MethodTarget.custom(RECV + "\\.charAt\\(([^()]*)\\)", "$1[$2]")));
        t.add(new MethodMapping("count", null, TEXT,
                MethodTarget.unsupported("use split(sub).length - 1 or filter(...).length"), null));
        t.add(new MethodMapping("capitalize", null, TEXT,
                MethodTarget.unsupported("use charAt(0).toUpperCase() + slice(1)"), null));
        t.add(new MethodMapping("title", null, TEXT,
                MethodTarget.unsupported("no built-in title case"), null));
        t.add(new MethodMapping("swapcase", null, TEXT,
                MethodTarget.unsupported("no built-in case swap"), null));
        t.add(new MethodMapping(null, "includes", TEXT,
                null, MethodTarget.unsupported("use the 'in' operator")));

        // sequence
        t.add(MethodMapping.renamed("append", "push", SEQUENCE));
        t.add(MethodMapping.renamed("extend", "concat", SEQUENCE));
        t.add(new MethodMapping("index", "indexOf", SEQUENCE, MethodTarget.rename("indexOf"), null));
        t.add(new MethodMapping("copy", "slice", SEQUENCE,
                MethodTarget.rename("slice"), MethodTarget.unsupported("use slice notation a[start:end]")));
        t.add(new MethodMapping("insert", null, SEQUENCE,
                MethodTarget.unsupported("use splice(index, 0, item)"), null));
        t.add(new MethodMapping("remove", null, SEQUENCE,
                MethodTarget.unsupported("use splice(indexOf(item), 1)"), null));
        t.add(new MethodMapping("clear", null, SEQUENCE,
                MethodTarget.unsupported("assign length = 0 or a new empty value"), null));
        t.add(new MethodMapping(null, "splice", SEQUENCE,
                null, MethodTarget.unsupported("use insert(), del or slice assignment")));
        t.add(new MethodMapping(null, "forEach", SEQUENCE,
                null, MethodTarget.unsupported("use a for loop")));
        t.add(new MethodMapping("any", "some", SEQUENCE,
                MethodTarget.unsupported("use Array.prototype.some with an arrow function"),
                MethodTarget.custom(RECV + "\\.some\\(\\s*\\(?(\\w+)\\)?\\s*=>\\s*([^()]*?)\\s*\\)", "any($3 for $2 in $1)")));
        t.add(new MethodMapping("all", "every", SEQUENCE,
                MethodTarget.unsupported("use Array.prototype.every with an arrow function"),
                MethodTarget.custom(RECV + "\\.every\\(\\s*\\(?(\\w+)\\)?\\s*=>\\s*([^()]*?)\\s*\\)", "all($3 for $2 in $1)")));

        // associative collections
        t.add(new MethodMapping("keys", "Object.keys", ASSOCIATIVE,
                MethodTarget.custom(RECV + "\\.keys\\(\\s*\\)", "Object.keys($1)"),
                MethodTarget.custom("Object\\.keys\\(\\s*" + RECV + "\\s*\\)", "$1.keys()")));
        t.add(new MethodMapping("values", "Object.values", ASSOCIATIVE,
                MethodTarget.custom(RECV + "\\.values\\(\\s*\\)", "Object.values($1)"),
                MethodTarget.custom("Object\\.values\\(\\s*" + RECV + "\\s*\\)", "$1.values()")));
        t.add(new MethodMapping("items", "Object.entries", ASSOCIATIVE,
                MethodTarget.custom(RECV + "\\.items\\(\\s*\\)", "Object.entries($1)"),
                MethodTarget.custom("Object\\.entries\\(\\s*" + RECV + "\\s*\\)", "$1.items()")));
        t.add(new MethodMapping("get", null, ASSOCIATIVE,
                MethodTarget.custom(
                        RECV + "\\.get\\(([^,()]+),\\s*([^()]+?)\\s*\\)", "($1[$2] ?? $3)",
                        RECV + "\\.get\\(([^,()]+)\\)", "$1[$2]"),
                null));
        t.add(new MethodMapping("update", "Object.assign", ASSOCIATIVE,
                MethodTarget.custom(RECV + "\\.update\\(([^()]+)\\)", "Object.assign($1, $2)"),
                MethodTarget.custom("Object\\.assign\\(\\s*" + RECV + "\\s*,\\s*([^()]+?)\\s*\\)", "$1.update($2)")));
        t.add(new MethodMapping(null, "hasOwnProperty", ASSOCIATIVE,
                null, MethodTarget.custom(RECV + "\\.hasOwnProperty\\(([^()]+)\\)", "$2 in $1")));
        t.add(new MethodMapping("setdefault", null, ASSOCIATIVE,
                MethodTarget.unsupported("use obj[key] ??= value"), null));
        t.add(new MethodMapping("popitem", null, ASSOCIATIVE,
                MethodTarget.unsupported("no ordered pop on plain objects"), null));

        // free functions
        t.add(new MethodMapping("len", "length", FREE_FUNCTION,
                MethodTarget.custom("(?<![\\w.])len\\(\\s*" + RECV + "\\s*\\)", "$1.length"),
                MethodTarget.custom(RECV + "\\.length\\b(?!\\s*\\()", "len($1)")));
        t.add(MethodMapping.renamed("str", "String", FREE_FUNCTION));
        t.add(MethodMapping.renamed("int", "parseInt", FREE_FUNCTION));
        t.add(MethodMapping.renamed("float", "parseFloat", FREE_FUNCTION));
        t.add(MethodMapping.renamed("bool", "Boolean", FREE_FUNCTION));
        t.add(MethodMapping.renamed("abs", "Math.abs", FREE_FUNCTION));
        t.add(MethodMapping.renamed("round", "Math.round", FREE_FUNCTION));
        t.add(MethodMapping.renamed("min", "Math.min", FREE_FUNCTION));
        t.add(MethodMapping.renamed("max", "Math.max", FREE_FUNCTION));
        t.add(MethodMapping.renamed("pow", "Math.pow", FREE_FUNCTION));
        t.add(MethodMapping.renamed("json.dumps", "JSON.stringify", FREE_FUNCTION));
        t.add(MethodMapping.renamed("json.loads", "JSON.parse", FREE_FUNCTION));
        t.add(new MethodMapping("type", "typeof", FREE_FUNCTION,
                MethodTarget.custom("(?<![\\w.])type\\(([^()]+)\\)", "typeof $1"),
                MethodTarget.custom("\\btypeof\\s+([\\w.]+)", "type($1)")));
        t.add(new MethodMapping("sorted", null, FREE_FUNCTION,
                MethodTarget.custom("(?<![\\w.])sorted\\(\\s*" + RECV + "\\s*\\)", "[...$1].sort()"), null));
        t.add(new MethodMapping("sum", null, FREE_FUNCTION,
                MethodTarget.unsupported("use reduce((a, b) => a + b, 0)"), null));
        t.add(new MethodMapping("zip", null, FREE_FUNCTION,
                MethodTarget.unsupported("use map((x, i) => [x, other[i]])"), null));
        t.add(new MethodMapping("enumerate", null, FREE_FUNCTION,
                MethodTarget.unsupported("use entries() or map((x, i) => ...)"), null));
        t.add(new MethodMapping("isinstance", null, FREE_FUNCTION,
                MethodTarget.unsupported("use instanceof or typeof"), null));

        return Collections.unmodifiableList(t);
    }
}
