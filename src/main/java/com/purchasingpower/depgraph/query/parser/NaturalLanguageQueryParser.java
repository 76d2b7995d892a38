package com.purchasingpower.depgraph.query.parser;

import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.NodeType;
import com.purchasingpower.depgraph.exception.QuerySyntaxException;
import com.purchasingpower.depgraph.query.AttributeFilter;
import com.purchasingpower.depgraph.query.FilterOperator;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryField;
import com.purchasingpower.depgraph.query.QueryPlan;
import com.purchasingpower.depgraph.query.TraversalMode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Intent classifier for plain-English questions.
 *
 * <p>No language understanding happens here: a fixed list of phrasings is
 * mapped onto traversals (callers, callees, dependencies, dependents,
 * subclasses, implementations, superclasses, contents, imports) or onto a
 * listing by node type. Anything else becomes a keyword search on symbol names.
 *
 * @since 2.0.0
 */
@Slf4j
public class NaturalLanguageQueryParser implements QueryParser {

    private static final Pattern COMMAND_PREFIX = Pattern.compile(
            "^(?:please\\s+)?(?:find|show|list|get|display|give)\\s+(?:me\\s+)?(?:all\\s+)?(?:of\\s+)?(?:the\\s+)?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DEPTH = Pattern.compile(
            "\\s*\\b(?:(?:within|with|at|up\\s+to)\\s+)?(?:a\\s+)?(?:max(?:imum)?\\s+)?depth(?:\\s+of)?\\s+(\\d+)\\b"
                    + "|\\s*\\b(?:within|up\\s+to)\\s+(\\d+)\\s+(?:levels?|hops?)(?:\\s+deep)?\\b"
                    + "|\\s*\\b(\\d+)\\s+(?:levels?|hops?)\\s+deep\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LIMIT = Pattern.compile(
            "\\s*\\b(?:limit(?:ed)?\\s+(?:to\\s+)?|top\\s+|first\\s+)(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern ORDER = Pattern.compile(
            "\\s*\\b(?:ordered|sorted|order|sort)\\s+by\\s+([\\w.]+)(?:\\s+(asc|desc|ascending|descending))?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TRANSITIVE_HINT = Pattern.compile(
            "\\b(?:all|transitive(?:ly)?|recursive(?:ly)?|indirect(?:ly)?)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern FILE_CLAUSE = Pattern.compile(
            "\\b(?:in|from)\\s+(?:the\\s+)?file\\s+(\\S+)|\\b(?:in|from)\\s+(\\S+\\.\\w+|\\S*/\\S*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern PROJECT_CLAUSE = Pattern.compile(
            "\\b(?:in|from)\\s+project\\s+(\\S+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern NAME_CLAUSE = Pattern.compile(
            "\\b(named|called|matching|containing|like)\\s+(\\S+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONDITION_CLAUSE = Pattern.compile(
            "\\b(?:that|which|where|with)\\s+(?<target>.+)$", Pattern.CASE_INSENSITIVE);

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "all", "any", "of", "in", "on", "to", "for", "from", "by", "with", "and", "or",
            "is", "are", "was", "be", "me", "my", "show", "find", "list", "get", "display", "give", "what",
            "which", "who", "where", "that", "this", "these", "those", "does", "do", "there", "please", "it",
            "its", "code", "symbols", "symbol", "things", "everything");

    private final List<Intent> intents = List.of(
            intent("^(?:who|what|which\\s+(?<kind>\\w+))\\s+(?:calls?|invokes?)\\s+(?<target>.+)$", "calls", EdgeDirection.IN),
            intent("^(?:callers|invokers)\\s+of\\s+(?<target>.+)$", "calls", EdgeDirection.IN),
            intent("^(?<kind>functions|methods)\\s+(?:that|which)\\s+call\\s+(?<target>.+)$", "calls", EdgeDirection.IN),
            intent("^what\\s+(?:does|do)\\s+(?<target>.+?)\\s+(?:call|invoke)$", "calls", EdgeDirection.OUT),
            intent("^(?:callees|calls)\\s+(?:of|from|made\\s+by)\\s+(?<target>.+)$", "calls", EdgeDirection.OUT),
            intent("^(?<kind>functions|methods)\\s+called\\s+by\\s+(?<target>.+)$", "calls", EdgeDirection.OUT),
            intent("^what\\s+(?:does|do)\\s+(?<target>.+?)\\s+depend\\s+on$", "depends_on", EdgeDirection.OUT),
            intent("^dependencies\\s+of\\s+(?<target>.+)$", "depends_on", EdgeDirection.OUT),
            intent("^(?:who|what|which\\s+(?<kind>\\w+))\\s+depends?\\s+on\\s+(?<target>.+)$", "depends_on", EdgeDirection.IN),
            intent("^dependents\\s+of\\s+(?<target>.+)$", "depends_on", EdgeDirection.IN),
            intent("^what\\s+(?:does|do)\\s+(?<target>.+?)\\s+(?:extend|inherit\\s+from)$", "extends", EdgeDirection.OUT),
            intent("^(?:superclasses|supertypes|parents|base\\s+classes|ancestors)\\s+of\\s+(?<target>.+)$", "extends", EdgeDirection.OUT),
            intent("^(?:who|what|which\\s+(?<kind>\\w+))\\s+(?:extends?|inherits?\\s+from)\\s+(?<target>.+)$", "extends", EdgeDirection.IN),
            intent("^(?:subclasses|subtypes|derived\\s+classes|descendants)\\s+of\\s+(?<target>.+)$", "extends", EdgeDirection.IN),
            intent("^(?<kind>classes|types)\\s+(?:that|which)\\s+(?:extend|inherit\\s+from)\\s+(?<target>.+)$", "extends", EdgeDirection.IN),
            intent("^(?:who|what|which\\s+(?<kind>\\w+))\\s+implements?\\s+(?<target>.+)$", "implements", EdgeDirection.IN),
            intent("^(?:implementations|implementers|implementors)\\s+of\\s+(?<target>.+)$", "implements", EdgeDirection.IN),
            intent("^(?<kind>classes|types)\\s+(?:that|which)\\s+implement\\s+(?<target>.+)$", "implements", EdgeDirection.IN),
            intent("^what\\s+(?:does|do)\\s+(?<target>.+?)\\s+(?:contain|declare)$", "contains", EdgeDirection.OUT),
            intent("^(?:contents|members|children)\\s+of\\s+(?<target>.+)$", "contains", EdgeDirection.OUT),
            intent("^what\\s+is\\s+(?:in|inside)\\s+(?<target>.+)$", "contains", EdgeDirection.OUT),
            intent("^what\\s+(?:does|do)\\s+(?<target>.+?)\\s+import$", "imports", EdgeDirection.OUT),
            intent("^imports\\s+(?:of|in)\\s+(?<target>.+)$", "imports", EdgeDirection.OUT));

    @Override
    public QueryDialect dialect() {
        return QueryDialect.NATURAL_LANGUAGE;
    }

    @Override
    public QueryPlan parse(String query) {
        if (query == null || query.isBlank()) {
            throw new QuerySyntaxException("Query is empty", query);
        }
        QueryPlan.QueryPlanBuilder plan = QueryPlan.builder().dialect(QueryDialect.NATURAL_LANGUAGE);
        String text = query.trim().replaceAll("\\s+", " ").replaceAll("[?.!]+$", "");

        Integer depth = null;
        Matcher depthMatcher = DEPTH.matcher(text);
        if (depthMatcher.find()) {
            depth = number(firstGroup(depthMatcher), query);
            text = depthMatcher.replaceFirst("");
        }
        Matcher limitMatcher = LIMIT.matcher(text);
        if (limitMatcher.find()) {
            plan.limit(number(limitMatcher.group(1), query));
            text = limitMatcher.replaceFirst("");
        }
        Matcher orderMatcher = ORDER.matcher(text);
        if (orderMatcher.find()) {
            String direction = orderMatcher.group(2);
            plan.orderBy(new QueryPlan.OrderBy(orderMatcher.group(1),
                    direction != null && direction.toLowerCase(Locale.ROOT).startsWith("desc")));
            text = orderMatcher.replaceFirst("");
        }
        text = text.trim();

        String core = COMMAND_PREFIX.matcher(text).replaceFirst("").trim();
        boolean transitive = TRANSITIVE_HINT.matcher(core).find();
        String coreWithoutHints = TRANSITIVE_HINT.matcher(core).replaceAll("").replaceAll("\\s+", " ").trim();

        Optional<QueryPlan.Traversal> traversal = matchIntent(coreWithoutHints, depth, transitive, plan);
        if (traversal.isPresent()) {
            log.debug("Classified '{}' as {} {} traversal", query, traversal.get().getEdgeType(),
                    traversal.get().getDirection());
            return plan.traversal(traversal.get()).build();
        }

        if (listing(core, plan)) {
            return plan.build();
        }

        List<List<AttributeFilter>> keywordGroups = keywordGroups(core, List.of());
        if (keywordGroups.isEmpty()) {
            throw new QuerySyntaxException("Could not interpret natural language query", query);
        }
        return plan.filterGroups(keywordGroups).build();
    }

    private Optional<QueryPlan.Traversal> matchIntent(String text, Integer depth, boolean transitive,
                                                      QueryPlan.QueryPlanBuilder plan) {
        for (Intent intent : intents) {
            Matcher matcher = intent.pattern().matcher(text);
            if (!matcher.matches()) {
                continue;
            }
            String target = cleanTarget(matcher.group("target"));
            if (target.isEmpty()) {
                continue;
            }
            if (intent.typed()) {
                // "types" and unknown words leave the traversal unrestricted.
                Optional.ofNullable(matcher.group("kind"))
                        .flatMap(NodeType::fromLenient)
                        .filter(type -> type != NodeType.TYPE)
                        .ifPresent(type -> plan.nodeTypes(Set.of(type)));
            }
            // Closure is only defined outward; inward "all" widens the depth instead.
            boolean closure = transitive && intent.direction() == EdgeDirection.OUT;
            Integer effectiveDepth = depth;
            if (transitive && !closure && effectiveDepth == null) {
                effectiveDepth = Integer.MAX_VALUE;
            }
            return Optional.of(QueryPlan.Traversal.builder()
                    .rootReference(target)
                    .edgeType(intent.edgeType())
                    .direction(intent.direction())
                    .depth(effectiveDepth)
                    .mode(closure ? TraversalMode.TRANSITIVE : TraversalMode.HIERARCHICAL)
                    .build());
        }
        return Optional.empty();
    }

    /**
     * "classes in file src/a.ts named Foo", "methods that handle payment".
     */
    private boolean listing(String core, QueryPlan.QueryPlanBuilder plan) {
        String[] words = core.split(" ", 2);
        Optional<NodeType> type = NodeType.fromLenient(words[0]);
        if (type.isEmpty()) {
            return false;
        }
        plan.nodeTypes(Set.of(type.get()));
        String rest = words.length > 1 ? words[1] : "";

        List<AttributeFilter> base = new ArrayList<>();
        Matcher project = PROJECT_CLAUSE.matcher(rest);
        if (project.find()) {
            base.add(AttributeFilter.eq(QueryField.PROJECT_NAME, stripQuotes(project.group(1))));
            rest = project.replaceFirst("");
        }
        Matcher file = FILE_CLAUSE.matcher(rest);
        if (file.find()) {
            base.add(AttributeFilter.like(QueryField.FILE_PATH, stripQuotes(firstGroup(file))));
            rest = file.replaceFirst("");
        }
        Matcher name = NAME_CLAUSE.matcher(rest);
        if (name.find()) {
            String keyword = name.group(1).toLowerCase(Locale.ROOT);
            String value = stripQuotes(name.group(2));
            base.add(keyword.equals("named") || keyword.equals("called")
                    ? AttributeFilter.eq(QueryField.SYMBOL_NAME, value)
                    : AttributeFilter.like(QueryField.SYMBOL_NAME, value));
            rest = name.replaceFirst("");
        }

        Matcher condition = CONDITION_CLAUSE.matcher(rest.trim());
        List<List<AttributeFilter>> groups = condition.find()
                ? keywordGroups(condition.group(1), base)
                : List.of();
        if (groups.isEmpty() && !base.isEmpty()) {
            groups = List.of(List.copyOf(base));
        }
        plan.filterGroups(groups);
        return true;
    }

    /**
     * One group per keyword, each ANDed with {@code base}: a node matches when its
     * symbol name contains any keyword.
     */
    private static List<List<AttributeFilter>> keywordGroups(String text, List<AttributeFilter> base) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String word : text.split("[^A-Za-z0-9_$]+")) {
            String lower = word.toLowerCase(Locale.ROOT);
            if (lower.length() >= 2 && !STOP_WORDS.contains(lower)) {
                keywords.add(word);
            }
        }
        List<List<AttributeFilter>> groups = new ArrayList<>();
        for (String keyword : keywords) {
            List<AttributeFilter> group = new ArrayList<>(base);
            group.add(new AttributeFilter(QueryField.SYMBOL_NAME, FilterOperator.LIKE, keyword));
            groups.add(List.copyOf(group));
        }
        return groups;
    }

    private static String cleanTarget(String raw) {
        List<String> words = new ArrayList<>(Arrays.asList(stripQuotes(raw.trim()).split(" ")));
        if (!words.isEmpty() && words.get(0).equalsIgnoreCase("the")) {
            words.remove(0);
        }
        if (words.size() > 1 && NodeType.fromLenient(words.get(0)).isPresent()) {
            words.remove(0);
        }
        return stripQuotes(String.join(" ", words).trim());
    }

    private static String stripQuotes(String value) {
        return value.replaceAll("^[\"'`]+|[\"'`]+$", "");
    }

    private static int number(String digits, String query) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new QuerySyntaxException("Number out of range: " + digits, query);
        }
    }

    private static String firstGroup(Matcher matcher) {
        for (int i = 1; i <= matcher.groupCount(); i++) {
            if (matcher.group(i) != null) {
                return matcher.group(i);
            }
        }
        throw new IllegalStateException("No group matched");
    }

    private static Intent intent(String regex, String edgeType, EdgeDirection direction) {
        return new Intent(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), edgeType, direction,
                regex.contains("(?<kind>"));
    }

    private record Intent(Pattern pattern, String edgeType, EdgeDirection direction, boolean typed) {
    }
}
