package io.segmentnav.core.engine;

import io.segmentnav.core.model.NodeKind;
import io.segmentnav.core.model.SchemaNode;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Lazy depth-first walk over a schema tree that yields the token nodes reachable from a start
 * node, in declaration order as far as the {@link NeighbourRule} allows.
 *
 * <p>
 * The walk keeps an explicit stack and a visited set (by identity), so every node is expanded at
 * most once and the walk ends even though groups point back at their own first child. Each call
 * to {@link #next()} does only the work needed to reach the next token node; dropping the iterator
 * abandons the walk with nothing to undo.
 *
 * <p>
 * Not thread-safe and not restartable: one iterator per enumeration. The schema tree itself is
 * only read.
 */
public final class TokenNodeIterator implements Iterator<SchemaNode> {

    private final List<SchemaNode> chain;
    private final Set<SchemaNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Deque<SchemaNode> stack = new ArrayDeque<>();
    private SchemaNode next;

    /**
     * Starts a walk at {@code startNode}. The start node's ancestor chain is computed once, here.
     *
     * @param startNode where the walk begins, normally the last matched token node
     * @throws io.segmentnav.core.error.StructuralException if the tree's parent links are corrupted
     */
    public TokenNodeIterator(SchemaNode startNode) {
        this.chain = AncestorChains.ancestorChain(startNode);
        stack.push(startNode);
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public SchemaNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        SchemaNode result = next;
        next = null;
        return result;
    }

    private SchemaNode advance() {
        while (!stack.isEmpty()) {
            SchemaNode current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }

            List<SchemaNode> neighbours = NeighbourRule.neighbours(current, chain);
            for (int i = neighbours.size() - 1; i >= 0; i--) {
                SchemaNode neighbour = neighbours.get(i);
                if (!visited.contains(neighbour)) {
                    stack.push(neighbour);
                }
            }

            if (current.kind() == NodeKind.TOKEN) {
                return current;
            }
        }
        return null;
    }
}
