package com.clinical.phenotype.binder;

import com.clinical.phenotype.core.model.CodeSystem;
import com.clinical.phenotype.core.model.Cohort;
import com.clinical.phenotype.core.model.CohortReference;
import com.clinical.phenotype.core.model.ConceptExpansion;
import com.clinical.phenotype.core.model.ContextType;
import com.clinical.phenotype.core.model.DeclarationKind;
import com.clinical.phenotype.core.model.Define;
import com.clinical.phenotype.core.model.DocumentCriteria;
import com.clinical.phenotype.core.model.DocumentSet;
import com.clinical.phenotype.core.model.Include;
import com.clinical.phenotype.core.model.ParameterValue;
import com.clinical.phenotype.core.model.PhenotypeLibrary;
import com.clinical.phenotype.core.model.SourcePosition;
import com.clinical.phenotype.core.model.TaskInvocation;
import com.clinical.phenotype.core.model.TermSet;
import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.core.model.ValueType;
import com.clinical.phenotype.expression.BoundExpression;
import com.clinical.phenotype.expression.ExpressionBody;
import com.clinical.phenotype.graph.CyclicDependencyException;
import com.clinical.phenotype.graph.DependencyGraph;
import com.clinical.phenotype.graph.GraphNode;
import com.clinical.phenotype.script.PhenotypeSyntaxException;
import com.clinical.phenotype.script.ast.Call;
import com.clinical.phenotype.script.ast.ExpressionNode;
import com.clinical.phenotype.script.ast.Operator;
import com.clinical.phenotype.script.ast.ParamNode;
import com.clinical.phenotype.script.ast.Script;
import com.clinical.phenotype.script.ast.Statement;
import com.clinical.phenotype.task.TaskExecutor;
import com.clinical.phenotype.task.TaskRegistry;
import com.clinical.phenotype.task.TaskSignature;
import com.clinical.phenotype.task.UnknownTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a parsed script into a {@link CompiledPhenotype}.
 *
 * <p>Checks run in a fixed order so that a script with several problems always reports the
 * same one: duplicate names, undeclared identifiers, unknown tasks, cycles, forward references,
 * then types. Binding is pure: the task registry is only read.</p>
 */
public class SymbolBinder {

    private static final Logger log = LoggerFactory.getLogger(SymbolBinder.class);

    public static final String PARAM_TERMSET = "termset";
    public static final String PARAM_DOCUMENTSET = "documentset";
    public static final String PARAM_COHORT = "cohort";

    private static final Map<String, DeclarationKind> SCOPED_PARAMETERS = Map.of(
            PARAM_TERMSET, DeclarationKind.TERMSET,
            PARAM_DOCUMENTSET, DeclarationKind.DOCUMENTSET,
            PARAM_COHORT, DeclarationKind.COHORT);

    private static final Set<String> DOCUMENT_SET_FUNCTIONS =
            Set.of("createReportTagList", "createReportTypeList", "createDocumentSet");
    private static final Set<String> COHORT_FUNCTIONS = Set.of("getCohort", "getCohortByName");
    private static final Set<String> DOCUMENT_SET_KEYS = Set.of(
            DocumentCriteria.REPORT_TYPES, DocumentCriteria.REPORT_TAGS, DocumentCriteria.PROVIDER_ROLES,
            DocumentCriteria.SOURCE, DocumentCriteria.FILTER_QUERY);

    private final TaskRegistry registry;

    public SymbolBinder(TaskRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    private record Declaration(String name, DeclarationKind kind, int order, SourcePosition position,
                               Statement statement) {
    }

    private record Use(String name, SourcePosition position) {
    }

    public CompiledPhenotype bind(Script script) {
        Map<String, Declaration> declarations = collectDeclarations(script);
        checkDeclared(script, declarations);
        checkTasks(script, declarations);
        DependencyGraph graph = buildGraph(script, declarations);
        checkForwardReferences(script, declarations);

        PhenotypeLibrary library = new Binding(declarations).bindLibrary(script);
        List<String> order = graph.topologicalOrder();
        log.debug("Bound phenotype {}: {} declarations, {} graph nodes, {} edges",
                library.getName(), declarations.size(), graph.nodes().size(), graph.edges().size());
        return new CompiledPhenotype(library, graph, order);
    }

    // ---- pass 0: names ----

    private Map<String, Declaration> collectDeclarations(Script script) {
        Map<String, Declaration> declarations = new LinkedHashMap<>();
        int order = 0;
        for (Statement statement : script.statements()) {
            String name;
            DeclarationKind kind;
            if (statement instanceof Statement.Include s) {
                name = s.alias();
                kind = DeclarationKind.INCLUDE;
            } else if (statement instanceof Statement.CodeSystem s) {
                name = s.name();
                kind = DeclarationKind.CODESYSTEM;
            } else if (statement instanceof Statement.TermSet s) {
                name = s.name();
                kind = DeclarationKind.TERMSET;
            } else if (statement instanceof Statement.DocumentSet s) {
                name = s.name();
                kind = DeclarationKind.DOCUMENTSET;
            } else if (statement instanceof Statement.Cohort s) {
                name = s.name();
                kind = DeclarationKind.COHORT;
            } else if (statement instanceof Statement.Define s) {
                name = s.name();
                kind = DeclarationKind.DEFINE;
            } else {
                continue;
            }
            Declaration previous = declarations.get(name);
            if (previous != null) {
                throw new DuplicateDeclarationException(name, previous.position(), statement.position());
            }
            declarations.put(name, new Declaration(name, kind, order++, statement.position(), statement));
        }
        return declarations;
    }

    // ---- pass 1: every identifier names something ----

    private void checkDeclared(Script script, Map<String, Declaration> declarations) {
        for (Statement statement : script.statements()) {
            for (Use use : usesOf(statement)) {
                if (!declarations.containsKey(use.name())) {
                    throw UnresolvedReferenceException.undeclared(use.name(), use.position());
                }
            }
        }
    }

    private static List<Use> usesOf(Statement statement) {
        List<Use> uses = new ArrayList<>();
        Call call = callOf(statement);
        if (call != null) {
            uses.add(new Use(call.qualifier(), call.position()));
            call.arguments().forEach(arg -> collectUses(arg, uses));
        }
        if (statement instanceof Statement.Define define && define.expression() != null) {
            collectUses(define.expression(), uses);
        }
        return uses;
    }

    private static Call callOf(Statement statement) {
        if (statement instanceof Statement.TermSet s) {
            return s.call();
        }
        if (statement instanceof Statement.DocumentSet s) {
            return s.call();
        }
        if (statement instanceof Statement.Cohort s) {
            return s.call();
        }
        if (statement instanceof Statement.Define s) {
            return s.call();
        }
        return null;
    }

    private static void collectUses(ParamNode node, List<Use> uses) {
        if (node instanceof ParamNode.Identifier id) {
            uses.add(new Use(id.name(), id.position()));
        } else if (node instanceof ParamNode.ListNode list) {
            list.items().forEach(item -> collectUses(item, uses));
        } else if (node instanceof ParamNode.ObjectNode object) {
            object.entries().values().forEach(value -> collectUses(value, uses));
        }
    }

    private static void collectUses(ExpressionNode node, List<Use> uses) {
        if (node instanceof ExpressionNode.Reference ref) {
            uses.add(new Use(ref.name(), ref.position()));
        } else if (node instanceof ExpressionNode.Binary binary) {
            collectUses(binary.left(), uses);
            collectUses(binary.right(), uses);
        } else if (node instanceof ExpressionNode.Not not) {
            collectUses(not.operand(), uses);
        } else if (node instanceof ExpressionNode.Negate negate) {
            collectUses(negate.operand(), uses);
        }
    }

    // ---- pass 2: tasks and constructors exist ----

    private void checkTasks(Script script, Map<String, Declaration> declarations) {
        for (Statement statement : script.statements()) {
            if (statement instanceof Statement.Define define && define.call() != null) {
                Call call = define.call();
                Declaration qualifier = declarations.get(call.qualifier());
                if (qualifier.kind() != DeclarationKind.INCLUDE) {
                    throw new TypeMismatchException("Task qualifier " + call.qualifier()
                            + " must be an include alias but is a " + qualifier.kind().getKeyword(), call.position());
                }
                String catalog = ((Statement.Include) qualifier.statement()).library();
                registry.require(catalog, call.function(), call.position());
            } else if (statement instanceof Statement.DocumentSet documentSet) {
                Call call = documentSet.call();
                if (!DOCUMENT_SET_FUNCTIONS.contains(call.function())) {
                    throw new UnknownTaskException(call.display(), call.position());
                }
            } else if (statement instanceof Statement.Cohort cohort) {
                Call call = cohort.call();
                if (!COHORT_FUNCTIONS.contains(call.function())) {
                    throw new UnknownTaskException(call.display(), call.position());
                }
            }
        }
    }

    // ---- pass 3: graph and cycles ----

    private DependencyGraph buildGraph(Script script, Map<String, Declaration> declarations) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (Declaration declaration : declarations.values()) {
            if (declaration.kind().isGraphNode()) {
                builder.node(new GraphNode(declaration.name(), declaration.kind(), declaration.order(),
                        declaration.position()));
            }
        }
        for (Statement statement : script.statements()) {
            if (!(statement instanceof Statement.Define define)) {
                continue;
            }
            for (Use use : usesOf(define)) {
                Declaration producer = declarations.get(use.name());
                if (producer.kind().isGraphNode()) {
                    builder.edge(define.name(), producer.name());
                }
            }
        }
        DependencyGraph graph = builder.build();
        Optional<List<String>> cycle = graph.findCycle();
        if (cycle.isPresent()) {
            throw new CyclicDependencyException(cycle.get(), graph.node(cycle.get().get(0)).position());
        }
        return graph;
    }

    // ---- pass 4: no forward references ----

    private void checkForwardReferences(Script script, Map<String, Declaration> declarations) {
        for (Statement statement : script.statements()) {
            Declaration self = declarationOf(statement, declarations);
            if (self == null) {
                continue;
            }
            for (Use use : usesOf(statement)) {
                if (declarations.get(use.name()).order() > self.order()) {
                    throw UnresolvedReferenceException.forward(use.name(), use.position());
                }
            }
        }
    }

    private static Declaration declarationOf(Statement statement, Map<String, Declaration> declarations) {
        for (Declaration declaration : declarations.values()) {
            if (declaration.statement() == statement) {
                return declaration;
            }
        }
        return null;
    }

    // ---- pass 5: types and model ----

    /**
     * Per-bind state for the final pass. Defines are typed in parse order, which is safe once
     * forward references are excluded.
     */
    private final class Binding {
        private final Map<String, Declaration> declarations;
        private final Map<String, Define> defines = new LinkedHashMap<>();
        private final Map<String, CodeSystem> codeSystems = new LinkedHashMap<>();

        Binding(Map<String, Declaration> declarations) {
            this.declarations = declarations;
        }

        PhenotypeLibrary bindLibrary(Script script) {
            PhenotypeLibrary.Builder builder = PhenotypeLibrary.builder();
            for (Statement statement : script.statements()) {
                if (statement instanceof Statement.Phenotype s) {
                    builder.name(s.name());
                    if (s.version() != null) {
                        builder.version(s.version());
                    }
                } else if (statement instanceof Statement.Version s) {
                    builder.version(s.version());
                } else if (statement instanceof Statement.Description s) {
                    builder.description(s.text());
                } else if (statement instanceof Statement.DataModel s) {
                    builder.dataModel(s.name(), s.version());
                } else if (statement instanceof Statement.Context s) {
                    ContextType context = ContextType.fromKeyword(s.context());
                    if (context == null) {
                        throw new PhenotypeSyntaxException("'Patient' or 'Document'", "'" + s.context() + "'",
                                s.position());
                    }
                    builder.context(context);
                } else if (statement instanceof Statement.Debug) {
                    builder.debug(true);
                } else if (statement instanceof Statement.Limit s) {
                    if (s.limit() <= 0) {
                        throw new TypeMismatchException("limit must be a positive integer", s.position());
                    }
                    builder.documentLimit(s.limit());
                } else if (statement instanceof Statement.Include s) {
                    builder.include(new Include(s.library(), s.version(), s.alias(), s.position()));
                } else if (statement instanceof Statement.CodeSystem s) {
                    CodeSystem codeSystem = new CodeSystem(s.name(), s.uri(), s.position());
                    codeSystems.put(s.name(), codeSystem);
                    builder.codeSystem(codeSystem);
                } else if (statement instanceof Statement.TermSet s) {
                    builder.termSet(bindTermSet(s));
                } else if (statement instanceof Statement.DocumentSet s) {
                    builder.documentSet(bindDocumentSet(s));
                } else if (statement instanceof Statement.Cohort s) {
                    builder.cohort(bindCohort(s));
                } else if (statement instanceof Statement.Define s) {
                    Define define = s.call() != null ? bindTaskDefine(s) : bindExpressionDefine(s);
                    defines.put(define.name(), define);
                    builder.define(define);
                }
            }
            return builder.build();
        }

        private TermSet bindTermSet(Statement.TermSet s) {
            if (s.call() == null) {
                return TermSet.literal(s.name(), s.terms(), s.position());
            }
            Call call = s.call();
            requireQualifier(call, DeclarationKind.CODESYSTEM, DeclarationKind.INCLUDE);
            CodeSystem codeSystem = codeSystems.get(call.qualifier());
            List<String> arguments = literalArguments(call);
            return TermSet.coded(s.name(), new ConceptExpansion(call.qualifier(),
                    codeSystem != null ? codeSystem.uri() : null, call.function(), arguments), s.position());
        }

        private DocumentSet bindDocumentSet(Statement.DocumentSet s) {
            Call call = s.call();
            requireQualifier(call, DeclarationKind.INCLUDE);
            DocumentCriteria criteria = switch (call.function()) {
                case "createReportTagList" ->
                        DocumentCriteria.of(DocumentCriteria.REPORT_TAGS, literalArguments(call));
                case "createReportTypeList" ->
                        DocumentCriteria.of(DocumentCriteria.REPORT_TYPES, literalArguments(call));
                default -> documentSetObject(call);
            };
            return new DocumentSet(s.name(), criteria, s.position());
        }

        private DocumentCriteria documentSetObject(Call call) {
            if (call.arguments().size() != 1 || !(call.arguments().get(0) instanceof ParamNode.ObjectNode object)) {
                throw new TypeMismatchException(call.display() + " expects a single object argument",
                        call.position());
            }
            Map<String, List<String>> filters = new LinkedHashMap<>();
            object.entries().forEach((key, value) -> {
                if (!DOCUMENT_SET_KEYS.contains(key)) {
                    throw new TypeMismatchException("Unknown document set filter '" + key + "', expected one of "
                            + DOCUMENT_SET_KEYS.stream().sorted().toList(), value.position());
                }
                List<String> values = new ArrayList<>();
                flattenLiterals(value, values);
                filters.put(key, values);
            });
            return new DocumentCriteria(filters);
        }

        private Cohort bindCohort(Statement.Cohort s) {
            Call call = s.call();
            requireQualifier(call, DeclarationKind.INCLUDE, DeclarationKind.CODESYSTEM);
            List<String> arguments = literalArguments(call);
            if (arguments.isEmpty()) {
                throw new TypeMismatchException(call.display() + " requires a cohort identifier", call.position());
            }
            return new Cohort(s.name(), new CohortReference(call.qualifier(), call.function(), arguments),
                    s.position());
        }

        private Define bindTaskDefine(Statement.Define s) {
            Call call = s.call();
            Statement.Include include = (Statement.Include) declarations.get(call.qualifier()).statement();
            TaskExecutor executor = registry.require(include.library(), call.function(), call.position());

            Map<String, ParameterValue> parameters = new LinkedHashMap<>();
            if (call.arguments().size() == 1 && call.arguments().get(0) instanceof ParamNode.ObjectNode object) {
                object.entries().forEach((key, value) -> parameters.put(key, bindParameter(key, value)));
            } else if (!call.arguments().isEmpty()) {
                throw new TypeMismatchException("Task " + call.display() + " expects a single object of parameters",
                        call.position());
            }
            TaskSignature signature = executor.getSignature();
            return new Define(s.name(), s.isFinal(),
                    new TaskInvocation(call.qualifier(), include.library(), call.function(), parameters),
                    signature.outputType(), signature.fields(), s.position());
        }

        private ParameterValue bindParameter(String key, ParamNode node) {
            DeclarationKind required = SCOPED_PARAMETERS.get(key);
            return bindParameterValue(key, required, node);
        }

        private ParameterValue bindParameterValue(String key, DeclarationKind required, ParamNode node) {
            if (node instanceof ParamNode.Literal literal) {
                return new ParameterValue.Literal(Value.of(literal.value()));
            }
            if (node instanceof ParamNode.Identifier id) {
                Declaration target = declarations.get(id.name());
                if (!target.kind().isGraphNode()) {
                    throw new TypeMismatchException(id.name() + " is a " + target.kind().getKeyword()
                            + " and cannot be passed as a task parameter", id.position());
                }
                if (required != null && target.kind() != required) {
                    throw new TypeMismatchException("Parameter '" + key + "' expects a " + required.getKeyword()
                            + " but " + id.name() + " is a " + target.kind().getKeyword(), id.position());
                }
                return new ParameterValue.Reference(id.name(), target.kind());
            }
            if (node instanceof ParamNode.ListNode list) {
                List<ParameterValue> items = new ArrayList<>();
                list.items().forEach(item -> items.add(bindParameterValue(key, required, item)));
                return new ParameterValue.ListValue(items);
            }
            ParamNode.ObjectNode object = (ParamNode.ObjectNode) node;
            Map<String, ParameterValue> entries = new LinkedHashMap<>();
            object.entries().forEach((k, v) -> entries.put(k, bindParameterValue(key, required, v)));
            return new ParameterValue.ObjectValue(entries);
        }

        private Define bindExpressionDefine(Statement.Define s) {
            BoundExpression expression = bindExpression(s.expression());
            requireCondition(expression, "define " + s.name());
            return new Define(s.name(), s.isFinal(), new ExpressionBody(expression), ValueType.BOOLEAN,
                    Map.of(), s.position());
        }

        private BoundExpression bindExpression(ExpressionNode node) {
            if (node instanceof ExpressionNode.Literal literal) {
                return new BoundExpression.Literal(Value.of(literal.value()), literal.position());
            }
            if (node instanceof ExpressionNode.Reference ref) {
                return bindReference(ref);
            }
            if (node instanceof ExpressionNode.Not not) {
                BoundExpression operand = bindExpression(not.operand());
                requireCondition(operand, "NOT");
                return new BoundExpression.Not(operand, not.position());
            }
            if (node instanceof ExpressionNode.Negate negate) {
                BoundExpression operand = bindExpression(negate.operand());
                requireType(operand, ValueType.NUMERIC, "unary '-'");
                return new BoundExpression.Negate(operand, negate.position());
            }
            ExpressionNode.Binary binary = (ExpressionNode.Binary) node;
            BoundExpression left = bindExpression(binary.left());
            BoundExpression right = bindExpression(binary.right());
            Operator operator = binary.operator();
            switch (operator.category()) {
                case LOGICAL -> {
                    requireCondition(left, operator.symbol());
                    requireCondition(right, operator.symbol());
                    return new BoundExpression.Logical(operator, left, right, binary.position());
                }
                case ORDERING -> {
                    requireType(left, ValueType.NUMERIC, "'" + operator.symbol() + "'");
                    requireType(right, ValueType.NUMERIC, "'" + operator.symbol() + "'");
                    return new BoundExpression.Comparison(operator, left, right, binary.position());
                }
                case EQUALITY -> {
                    if (left.type() != right.type() || left.type() == ValueType.STRUCTURED) {
                        throw new TypeMismatchException("Cannot compare " + describe(left) + " with "
                                + describe(right) + " using '" + operator.symbol() + "'", binary.position());
                    }
                    return new BoundExpression.Comparison(operator, left, right, binary.position());
                }
                default -> {
                    requireType(left, ValueType.NUMERIC, "'" + operator.symbol() + "'");
                    requireType(right, ValueType.NUMERIC, "'" + operator.symbol() + "'");
                    return new BoundExpression.Arithmetic(operator, left, right, binary.position());
                }
            }
        }

        private BoundExpression bindReference(ExpressionNode.Reference ref) {
            Declaration target = declarations.get(ref.name());
            if (target.kind() != DeclarationKind.DEFINE) {
                throw new TypeMismatchException(ref.name() + " is a " + target.kind().getKeyword()
                        + "; expressions may only reference defines", ref.position());
            }
            Define define = defines.get(ref.name());
            if (ref.field() == null) {
                return new BoundExpression.DefineRef(ref.name(), null, define.outputType(), ref.position());
            }
            if (define.outputType() == ValueType.STRUCTURED) {
                ValueType fieldType = define.outputFields().get(ref.field());
                if (fieldType == null) {
                    throw new TypeMismatchException("Define " + ref.name() + " has no field '" + ref.field()
                            + "'; available fields are " + define.outputFields().keySet(), ref.position());
                }
                return new BoundExpression.DefineRef(ref.name(), ref.field(), fieldType, ref.position());
            }
            if (!"value".equals(ref.field())) {
                throw new TypeMismatchException("Define " + ref.name() + " yields " + define.outputType()
                        + " values and has no field '" + ref.field() + "'", ref.position());
            }
            return new BoundExpression.DefineRef(ref.name(), ref.field(), define.outputType(), ref.position());
        }

        private void requireQualifier(Call call, DeclarationKind... allowed) {
            DeclarationKind actual = declarations.get(call.qualifier()).kind();
            for (DeclarationKind kind : allowed) {
                if (kind == actual) {
                    return;
                }
            }
            throw new TypeMismatchException("Qualifier " + call.qualifier() + " of " + call.display()
                    + " is a " + actual.getKeyword(), call.position());
        }

        private List<String> literalArguments(Call call) {
            List<String> values = new ArrayList<>();
            call.arguments().forEach(arg -> flattenLiterals(arg, values));
            return values;
        }

        private void flattenLiterals(ParamNode node, List<String> into) {
            if (node instanceof ParamNode.Literal literal) {
                into.add(literalText(literal.value()));
            } else if (node instanceof ParamNode.ListNode list) {
                list.items().forEach(item -> flattenLiterals(item, into));
            } else {
                throw new TypeMismatchException("Expected a literal or a list of literals", node.position());
            }
        }
    }

    private static void requireCondition(BoundExpression expression, String context) {
        boolean presenceTest = expression instanceof BoundExpression.DefineRef ref && ref.field() == null;
        if (expression.type() != ValueType.BOOLEAN && !presenceTest) {
            throw new TypeMismatchException(context + " expects a boolean condition but got "
                    + describe(expression), expression.position());
        }
    }

    private static void requireType(BoundExpression expression, ValueType expected, String context) {
        if (expression.type() != expected) {
            throw new TypeMismatchException(context + " expects " + expected + " operands but got "
                    + describe(expression), expression.position());
        }
    }

    private static String describe(BoundExpression expression) {
        if (expression instanceof BoundExpression.DefineRef ref) {
            return ref.display() + " (" + ref.type() + ")";
        }
        return expression.type().toString();
    }

    /**
     * Literal argument as text; whole numbers lose their fractional part so {@code getCohort(6)} reads "6".
     */
    static String literalText(Object value) {
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.toString(d.longValue());
        }
        return String.valueOf(value);
    }
}
