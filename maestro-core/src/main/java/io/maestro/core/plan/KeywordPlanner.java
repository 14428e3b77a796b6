package io.maestro.core.plan;

import io.maestro.core.plan.RequestConstraints.StructuredTask;
import io.maestro.core.task.TaskSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Planner that splits a goal into portions and maps each portion to capabilities through a
/// {@link CapabilityMatcher}.
///
/// ### Decomposition
/// 1. The goal is split on `;`, `,`, `and`, `then`, `and then` and `after that`; a portion
///    that names no keyword at all is joined back onto the portion before it, so
///    `Johnson and Johnson` stays one portion
/// 2. A portion introduced by `then`, `and then` or `after that` depends on the capabilities of
///    the portion before it
/// 3. Each distinct capability becomes one task, in order of first mention; its input carries
///    the portions that mentioned it
/// 4. Explicit `dependencies` constraints are added to the keyword-derived ones
/// 5. Tasks beyond `maxTasks`, tasks depending on anything that was not planned, and tasks caught
///    in a dependency cycle are reported as unroutable portions
/// 6. The remaining tasks are emitted in topological order, ties broken by first mention
///
/// A request carrying structured `tasks` constraints skips steps 1 to 3.
///
/// @implNote Thread-safe if the matcher is.
public class KeywordPlanner implements Planner {

    private static final Logger logger = Logger.getLogger(KeywordPlanner.class.getName());

    private static final Pattern SEPARATOR =
            Pattern.compile(
                    "\\s*(?:;|,|\\b(and\\s+then|after\\s+that|then|and)\\b)\\s*",
                    Pattern.CASE_INSENSITIVE);

    private final CapabilityMatcher matcher;

    public KeywordPlanner(CapabilityMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
    }

    @Override
    public Plan decompose(PlanRequest request, Set<String> knownCapabilities) {
        Set<String> known = new LinkedHashSet<>();
        for (String capability : knownCapabilities) {
            known.add(capability.toLowerCase(Locale.ROOT));
        }

        List<UnroutablePortion> unroutable = new ArrayList<>();
        List<Node> nodes =
                request.constraints().isStructured()
                        ? structuredNodes(request.constraints().tasks(), known)
                        : keywordNodes(request.goal(), known, unroutable);

        addExplicitDependencies(nodes, request.constraints().dependencies());
        Plan plan = finish(nodes, unroutable, request);

        logger.fine(
                "Planned "
                        + plan.tasks().size()
                        + " tasks, "
                        + plan.unroutablePortions().size()
                        + " unroutable portions");
        return plan;
    }

    /// Splits a goal into portions, marking those introduced by a sequencing connective.
    ///
    /// @param goal free-text goal, not null
    /// @return non-empty portions in order, never null
    static List<Portion> split(String goal) {
        List<Portion> portions = new ArrayList<>();
        Matcher separators = SEPARATOR.matcher(goal);
        int start = 0;
        boolean sequential = false;
        while (separators.find()) {
            String text = goal.substring(start, separators.start()).trim();
            if (!text.isEmpty()) {
                portions.add(new Portion(text, sequential, start, separators.start()));
                sequential = false;
            }
            String connective = separators.group(1);
            if (connective != null && !connective.equalsIgnoreCase("and")) {
                sequential = true;
            }
            start = separators.end();
        }
        String tail = goal.substring(start).trim();
        if (!tail.isEmpty()) {
            portions.add(new Portion(tail, sequential, start, goal.length()));
        }
        return portions;
    }

    // A portion with no keyword is read as the continuation of the one before it. A leading
    // keyword-less portion has nothing to join and is kept.
    private List<Portion> joinContinuations(
            String goal, List<Portion> portions, Set<String> known) {
        List<Portion> joined = new ArrayList<>();
        for (Portion portion : portions) {
            if (!joined.isEmpty() && matcher.match(portion.text(), known).isEmpty()) {
                Portion previous = joined.remove(joined.size() - 1);
                joined.add(previous.extendTo(goal, portion.end()));
            } else {
                joined.add(portion);
            }
        }
        return joined;
    }

    private List<Node> keywordNodes(
            String goal, Set<String> known, List<UnroutablePortion> unroutable) {
        List<Portion> portions = joinContinuations(goal, split(goal), known);
        if (portions.isEmpty()) {
            unroutable.add(new UnroutablePortion(goal, "goal is empty"));
            return List.of();
        }

        Map<String, Node> byCapability = new LinkedHashMap<>();
        Map<String, Set<String>> capabilityDependencies = new LinkedHashMap<>();
        List<String> previous = List.of();
        boolean previousUnroutable = false;

        for (Portion portion : portions) {
            List<String> matched = matcher.match(portion.text(), known);
            List<String> capabilities = matched.stream().filter(known::contains).toList();

            if (capabilities.isEmpty()) {
                String reason =
                        matched.isEmpty()
                                ? "no capability matches this portion"
                                : "no registered agent declares " + matched;
                unroutable.add(new UnroutablePortion(portion.text(), reason));
                previous = List.of();
                previousUnroutable = true;
                continue;
            }
            if (portion.sequential() && previousUnroutable) {
                unroutable.add(
                        new UnroutablePortion(
                                portion.text(),
                                "depends on a preceding portion that could not be planned"));
                previous = List.of();
                continue;
            }

            for (String capability : capabilities) {
                Node node = byCapability.computeIfAbsent(capability, Node::new);
                node.portions.add(portion.text());
                Set<String> dependencies =
                        capabilityDependencies.computeIfAbsent(
                                capability, k -> new LinkedHashSet<>());
                if (portion.sequential()) {
                    for (String before : previous) {
                        if (!before.equals(capability)) {
                            dependencies.add(before);
                        }
                    }
                }
            }
            previous = capabilities;
            previousUnroutable = false;
        }

        List<Node> nodes = new ArrayList<>(byCapability.values());
        Map<String, Integer> indexes = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            indexes.put(nodes.get(i).capability, i);
        }
        for (Node node : nodes) {
            node.input.put("goal", String.join("; ", node.portions));
            node.input.put("request_goal", goal);
            for (String dependency : capabilityDependencies.get(node.capability)) {
                node.dependencies.add(indexes.get(dependency));
            }
        }
        return nodes;
    }

    private List<Node> structuredNodes(List<StructuredTask> tasks, Set<String> known) {
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            StructuredTask task = tasks.get(i);
            Node node = new Node(task.capability());
            node.input.putAll(task.input());
            Object goal = task.input().get("goal");
            node.portions.add(goal != null ? goal.toString() : task.capability());
            for (Integer dependency : task.dependsOn()) {
                if (dependency < 0 || dependency >= tasks.size() || dependency == i) {
                    node.unroutableReason = "invalid dependency index " + dependency;
                } else {
                    node.dependencies.add(dependency);
                }
            }
            if (node.unroutableReason == null && !known.contains(task.capability())) {
                node.unroutableReason =
                        "no registered agent declares [" + task.capability() + "]";
            }
            nodes.add(node);
        }
        return nodes;
    }

    private void addExplicitDependencies(List<Node> nodes, Map<String, List<String>> explicit) {
        if (explicit.isEmpty()) {
            return;
        }
        for (Node node : nodes) {
            for (String required : explicit.getOrDefault(node.capability, List.of())) {
                boolean found = false;
                for (int i = 0; i < nodes.size(); i++) {
                    if (nodes.get(i).capability.equals(required) && nodes.get(i) != node) {
                        node.dependencies.add(i);
                        found = true;
                    }
                }
                if (!found && node.unroutableReason == null) {
                    node.unroutableReason = "depends on '" + required + "' which is not planned";
                }
            }
        }
    }

    private Plan finish(
            List<Node> nodes, List<UnroutablePortion> unroutable, PlanRequest request) {
        RequestConstraints constraints = request.constraints();

        if (constraints.maxTasks() != null) {
            int kept = 0;
            for (Node node : nodes) {
                if (node.unroutableReason != null) {
                    continue;
                }
                if (kept < constraints.maxTasks()) {
                    kept++;
                } else {
                    node.unroutableReason =
                            "exceeds the limit of " + constraints.maxTasks() + " tasks";
                }
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Node node : nodes) {
                if (node.unroutableReason != null) {
                    continue;
                }
                for (int dependency : node.dependencies) {
                    Node required = nodes.get(dependency);
                    if (required.unroutableReason != null) {
                        node.unroutableReason =
                                "depends on '"
                                        + required.capability
                                        + "' which could not be planned";
                        changed = true;
                        break;
                    }
                }
            }
        }

        List<Integer> order = topologicalOrder(nodes);
        Map<Integer, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            positions.put(order.get(i), i);
        }

        List<TaskSpec> specs = new ArrayList<>();
        for (int nodeIndex : order) {
            Node node = nodes.get(nodeIndex);
            List<Integer> dependsOn = new ArrayList<>();
            for (int dependency : node.dependencies) {
                dependsOn.add(positions.get(dependency));
            }
            dependsOn.sort(Integer::compare);
            specs.add(
                    new TaskSpec(
                            node.capability,
                            node.input,
                            dependsOn,
                            constraints.priority(),
                            constraints.timeout(),
                            null,
                            String.join("; ", node.portions)));
        }

        List<UnroutablePortion> portions = new ArrayList<>(unroutable);
        for (Node node : nodes) {
            if (node.unroutableReason != null) {
                portions.add(
                        new UnroutablePortion(
                                String.join("; ", node.portions), node.unroutableReason));
            }
        }

        String requestType = specs.isEmpty() ? Plan.GENERAL : specs.get(0).capability();
        return new Plan(specs, portions, requestType);
    }

    // Kahn's algorithm over the routable nodes; nodes left over are marked as cyclic.
    private static List<Integer> topologicalOrder(List<Node> nodes) {
        int[] inDegree = new int[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.unroutableReason == null) {
                inDegree[i] = node.dependencies.size();
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).unroutableReason == null && inDegree[i] == 0) {
                ready.add(i);
            }
        }

        List<Integer> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(current);
            for (int i = 0; i < nodes.size(); i++) {
                Node node = nodes.get(i);
                if (node.unroutableReason == null && node.dependencies.contains(current)) {
                    if (--inDegree[i] == 0) {
                        ready.add(i);
                    }
                }
            }
        }

        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.unroutableReason == null && !order.contains(i)) {
                node.unroutableReason = "part of a dependency cycle";
            }
        }
        return order;
    }

    /// One piece of a split goal.
    ///
    /// @param text portion text, trimmed
    /// @param sequential whether a sequencing connective introduced it
    /// @param start offset of the portion in the goal
    /// @param end offset just past the portion in the goal
    record Portion(String text, boolean sequential, int start, int end) {

        Portion extendTo(String goal, int newEnd) {
            return new Portion(goal.substring(start, newEnd).trim(), sequential, start, newEnd);
        }
    }

    private static final class Node {
        final String capability;
        final List<String> portions = new ArrayList<>();
        final Map<String, Object> input = new LinkedHashMap<>();
        final Set<Integer> dependencies = new LinkedHashSet<>();
        String unroutableReason;

        Node(String capability) {
            this.capability = capability;
        }
    }
}
