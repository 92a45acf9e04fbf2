package org.neuralchilli.stepgraph.selection;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Evaluates selection queries against an execution plan.
 * <p>
 * A query is a comma or whitespace separated union of {@link SelectionToken}s. Names match a
 * step key exactly, or a node handle, in which case every clone of a mapped node matches, and
 * a nested graph handle matches every op inside it. Traversal follows data and ordering
 * dependencies of the plan as currently expanded.
 */
@ApplicationScoped
public class SelectionEngine {

    private static final Logger log = LoggerFactory.getLogger(SelectionEngine.class);

    /**
     * Resolve a query into step keys, in topological order.
     *
     * @throws UnknownSelectionException if a token names nothing in the plan
     * @throws InvalidSelectionException if the query or a token is malformed
     */
    public Set<String> select(ExecutionPlan plan, String query) {
        List<SelectionToken> tokens = parse(query);

        Set<String> selected = new HashSet<>();
        for (SelectionToken token : tokens) {
            Set<String> roots = resolve(plan, token.name());
            selected.addAll(roots);
            if (token.includesAncestors()) {
                selected.addAll(traverse(roots, token.ancestorDepth(), plan::dependenciesOf));
            }
            if (token.includesDescendants()) {
                selected.addAll(traverse(roots, token.descendantDepth(), plan::dependentsOf));
            }
        }

        Set<String> ordered = new LinkedHashSet<>();
        for (String key : plan.topologicalOrder()) {
            if (selected.contains(key)) {
                ordered.add(key);
            }
        }
        log.debug("Selection '{}' resolved to {} steps", query, ordered.size());
        return ordered;
    }

    public List<SelectionToken> parse(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidSelectionException("Selection query cannot be empty");
        }
        List<SelectionToken> tokens = new ArrayList<>();
        for (String part : query.trim().split("[,\\s]+")) {
            if (!part.isEmpty()) {
                tokens.add(SelectionToken.parse(part));
            }
        }
        if (tokens.isEmpty()) {
            throw new InvalidSelectionException("Selection query has no tokens: '" + query + "'");
        }
        return tokens;
    }

    private Set<String> resolve(ExecutionPlan plan, String name) {
        Set<String> matches = new LinkedHashSet<>();
        for (String key : plan.allKeys()) {
            if (key.equals(name)) {
                matches.add(key);
                continue;
            }
            String handle = plan.handleOf(key).orElse(key);
            if (handle.equals(name) || handle.startsWith(name + ".")) {
                matches.add(key);
            }
        }
        if (matches.isEmpty()) {
            throw new UnknownSelectionException(name);
        }
        return matches;
    }

    /**
     * Breadth-first walk from the roots, stopping after {@code depth} levels unless unlimited.
     */
    private static Set<String> traverse(Set<String> roots, int depth, Function<String, Set<String>> next) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> frontier = new ArrayDeque<>(roots);
        int level = 0;

        while (!frontier.isEmpty() && (depth == SelectionToken.UNLIMITED || level < depth)) {
            Deque<String> following = new ArrayDeque<>();
            for (String key : frontier) {
                for (String neighbour : next.apply(key)) {
                    if (visited.add(neighbour)) {
                        following.add(neighbour);
                    }
                }
            }
            frontier = following;
            level++;
        }
        return visited;
    }
}
