package domain.convert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Indentation and open-block tracking for one conversion call.
 *
 * <p>The stack holds the source depth of every block whose opener was recognised. Popping
 * returns those depths so the caller can emit one closing delimiter per block, innermost
 * first. Depth never goes negative: closing with an empty stack is a no-op.</p>
 *
 * <p>Also remembers which names were already bound, so a re-binding does not declare twice.</p>
 */
public final class BlockState {

    private final Deque<Integer> open = new ArrayDeque<>();
    private final Set<String> declared = new HashSet<>();
    private int maxDepth;
    private int blockCount;

    public void enterBlock(int sourceDepth) {
        open.push(Math.max(0, sourceDepth));
        blockCount++;
        maxDepth = Math.max(maxDepth, open.size());
    }

    /** Pops one block; returns its source depth or -1 when none is open. */
    public int exitBlock() {
        if (open.isEmpty()) return -1;
        return open.pop();
    }

    /**
     * Pops every open block whose depth is at least {@code depth}.
     *
     * @return depths of the popped blocks, innermost first
     */
    public List<Integer> closeTo(int depth) {
        List<Integer> closed = new ArrayList<>();
        while (!open.isEmpty() && open.peek() >= depth) {
            closed.add(open.pop());
        }
        return closed;
    }

    public List<Integer> closeAll() {
        return closeTo(0);
    }

    public int currentDepth() {
        return open.size();
    }

    public int maxDepth() {
        return maxDepth;
    }

    public int blockCount() {
        return blockCount;
    }

    /** Records a binding; returns true when the name was not bound before in this call. */
    public boolean declare(String name) {
        return declared.add(name);
    }

    public boolean isDeclared(String name) {
        return declared.contains(name);
    }

    /**
     * Depth of an indentation-delimited line: width / 4, and 1 for any smaller non-zero width.
     */
    public static int indentDepth(int width) {
        if (width >= 4) return width / 4;
        return width > 0 ? 1 : 0;
    }

    /** Depth of a brace-delimited line for a detected unit of 2 or 4 spaces. */
    public static int braceDepth(int width, int unit) {
        if (width <= 0) return 0;
        return width / Math.max(1, unit);
    }

    /**
     * Picks 4 when every non-zero indentation width is a multiple of 4, otherwise 2.
     */
    public static int detectBraceUnit(List<Integer> widths) {
        boolean any = false;
        for (Integer w : widths) {
            if (w == null || w == 0) continue;
            any = true;
            if (w % 4 != 0) return 2;
        }
        return any ? 4 : 2;
    }

    /** Leading whitespace width; a tab counts as four columns. */
    public static int leadingWidth(String line) {
        if (line == null) return 0;
        int w = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') w++;
            else if (c == '\t') w += 4;
            else break;
        }
        return w;
    }
}
