package com.contractbridge.core.extractor;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.config.ProvidesConfig;
import com.contractbridge.core.io.ContractStore;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.Endpoint;
import com.contractbridge.core.model.EndpointKey;
import com.contractbridge.core.model.EndpointParameter;
import com.contractbridge.core.model.EndpointResponse;
import com.contractbridge.core.model.EndpointStatus;
import com.contractbridge.core.model.HttpMethod;
import com.contractbridge.core.model.ModelDefinition;
import com.contractbridge.core.model.ModelField;
import com.contractbridge.core.scanner.base.AbstractJavaSourceAnalyzer;
import com.contractbridge.core.util.FileUtils;
import com.contractbridge.core.util.Timestamps;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts a contract from Spring MVC controllers and Java model types.
 *
 * <p>Routes come from methods annotated with {@code @GetMapping}, {@code @PostMapping},
 * {@code @PutMapping}, {@code @DeleteMapping}, {@code @PatchMapping} or
 * {@code @RequestMapping}; a class-level {@code @RequestMapping} contributes a path
 * prefix. Models are records and classes extending or implementing {@code BaseModel}
 * or {@code ApiModel}.
 *
 * <p>Files are processed in order of their relative path and the first declaration of
 * an endpoint (method and path) or model name wins, so repeated runs over the same
 * sources produce the same contract.
 */
public class JavaContractExtractor extends AbstractJavaSourceAnalyzer implements ContractExtractor {

    private static final String PROVIDER_ROLE = "provider";

    private static final String REQUEST_MAPPING = "RequestMapping";
    private static final Map<String, HttpMethod> SHORTCUT_MAPPINGS = Map.of(
        "GetMapping", HttpMethod.GET,
        "PostMapping", HttpMethod.POST,
        "PutMapping", HttpMethod.PUT,
        "DeleteMapping", HttpMethod.DELETE,
        "PatchMapping", HttpMethod.PATCH
    );

    private static final Set<String> MODEL_MARKERS = Set.of("BaseModel", "ApiModel");
    private static final Set<String> COLLECTION_TYPES = Set.of("List", "Set", "Collection", "Iterable");
    private static final Set<String> OPTIONAL_TYPES = Set.of("Optional", "OptionalInt", "OptionalLong", "OptionalDouble");

    private static final int DEFAULT_STATUS = 200;
    private static final Map<String, Integer> HTTP_STATUS_CODES = Map.ofEntries(
        Map.entry("OK", 200),
        Map.entry("CREATED", 201),
        Map.entry("ACCEPTED", 202),
        Map.entry("NO_CONTENT", 204),
        Map.entry("MOVED_PERMANENTLY", 301),
        Map.entry("FOUND", 302),
        Map.entry("NOT_MODIFIED", 304),
        Map.entry("BAD_REQUEST", 400),
        Map.entry("UNAUTHORIZED", 401),
        Map.entry("FORBIDDEN", 403),
        Map.entry("NOT_FOUND", 404),
        Map.entry("CONFLICT", 409),
        Map.entry("GONE", 410),
        Map.entry("UNPROCESSABLE_ENTITY", 422),
        Map.entry("INTERNAL_SERVER_ERROR", 500),
        Map.entry("SERVICE_UNAVAILABLE", 503)
    );

    private static final String PATH_SEPARATOR = "/";

    private final Path repoRoot;
    private final String repoId;

    public JavaContractExtractor(Path repoRoot, String repoId) {
        super();
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot must not be null");
        this.repoId = repoId == null ? "" : repoId;
    }

    public JavaContractExtractor(BridgeConfig config) {
        this(config.getRepoRoot(), config.getRepoId());
    }

    @Override
    public Contract extract(List<String> globs) {
        String timestamp = Timestamps.now();
        Map<EndpointKey, Endpoint> endpoints = new LinkedHashMap<>();
        Map<String, ModelDefinition> models = new LinkedHashMap<>();

        List<Path> files;
        try {
            files = FileUtils.findFiles(repoRoot, globs);
        } catch (IOException e) {
            log.warn("Failed to list source files under {}: {}", repoRoot, e.getMessage());
            files = List.of();
        }
        log.debug("Extracting contract from {} file(s) matching {}", files.size(), globs);

        for (Path file : files) {
            String relativePath = FileUtils.relativePath(repoRoot, file);
            Optional<CompilationUnit> cu;
            try {
                cu = parseJavaFile(file);
            } catch (IOException e) {
                log.debug("Skipping unreadable file {}: {}", relativePath, e.getMessage());
                continue;
            }
            if (cu.isEmpty()) {
                continue;
            }
            for (Endpoint endpoint : extractEndpoints(cu.get(), relativePath, timestamp)) {
                Endpoint existing = endpoints.putIfAbsent(endpoint.key(), endpoint);
                if (existing != null) {
                    log.debug("Ignoring duplicate endpoint {} in {}", endpoint.key(), relativePath);
                }
            }
            extractModels(cu.get()).forEach(models::putIfAbsent);
        }

        log.info("Extracted {} endpoint(s) and {} model(s)", endpoints.size(), models.size());
        return new Contract(Contract.CURRENT_VERSION, repoId, PROVIDER_ROLE, timestamp,
            new ArrayList<>(endpoints.values()), models);
    }

    /**
     * Extracts the contract described by the {@code provides} section of a configuration
     * and writes it to {@code provides.contract_file}.
     *
     * @param config provider configuration
     * @return the written contract
     * @throws IOException if the contract cannot be written
     */
    public static Contract extractAndSave(BridgeConfig config) throws IOException {
        ProvidesConfig provides = config.getProvides().orElseGet(ProvidesConfig::defaults);
        List<String> globs = provides.extractFrom().isEmpty()
            ? List.of(ProvidesConfig.DEFAULT_SOURCE_GLOB)
            : provides.extractFrom();

        Contract contract = new JavaContractExtractor(config).extract(globs);
        ContractStore.save(config.resolve(provides.contractFile()), contract);
        return contract;
    }

    // ==================== Endpoints ====================

    private List<Endpoint> extractEndpoints(CompilationUnit cu, String sourceFile, String timestamp) {
        List<Endpoint> endpoints = new ArrayList<>();

        cu.findAll(ClassOrInterfaceDeclaration.class).forEach(classDecl -> {
            String basePath = findAnnotation(classDecl, REQUEST_MAPPING)
                .map(this::extractPath)
                .orElse("");

            for (MethodDeclaration method : classDecl.getMethods()) {
                extractEndpoint(method, basePath, sourceFile, timestamp).ifPresent(endpoints::add);
            }
        });

        return endpoints;
    }

    private Optional<Endpoint> extractEndpoint(MethodDeclaration method, String basePath,
                                               String sourceFile, String timestamp) {
        Optional<AnnotationExpr> mapping = method.getAnnotations().stream()
            .filter(ann -> SHORTCUT_MAPPINGS.containsKey(ann.getNameAsString())
                || REQUEST_MAPPING.equals(ann.getNameAsString()))
            .findFirst();

        if (mapping.isEmpty()) {
            return Optional.empty();
        }

        AnnotationExpr annotation = mapping.get();
        HttpMethod httpMethod = determineHttpMethod(annotation);
        String path = combinePaths(basePath, extractPath(annotation));

        List<EndpointParameter> parameters = method.getParameters().stream()
            .map(this::toParameter)
            .toList();

        Endpoint endpoint = new Endpoint(
            Endpoint.defaultId(httpMethod, path),
            path,
            httpMethod,
            EndpointStatus.IMPLEMENTED,
            timestamp,
            sourceFile,
            method.getNameAsString(),
            parameters,
            toResponse(method),
            List.of()
        );
        log.debug("Found endpoint {} {} -> {}", httpMethod, path, method.getNameAsString());
        return Optional.of(endpoint);
    }

    private HttpMethod determineHttpMethod(AnnotationExpr annotation) {
        HttpMethod shortcut = SHORTCUT_MAPPINGS.get(annotation.getNameAsString());
        if (shortcut != null) {
            return shortcut;
        }
        // @RequestMapping(method = RequestMethod.POST) or method = {RequestMethod.PUT}
        return getAnnotationAttribute(annotation, "method")
            .map(this::firstElement)
            .map(Expression::toString)
            .map(value -> value.substring(value.lastIndexOf('.') + 1))
            .flatMap(HttpMethod::fromString)
            .orElse(HttpMethod.GET);
    }

    private String extractPath(AnnotationExpr annotation) {
        return getAnnotationAttribute(annotation, "value")
            .or(() -> getAnnotationAttribute(annotation, "path"))
            .map(this::firstElement)
            .map(expr -> expr instanceof StringLiteralExpr literal
                ? literal.asString()
                : cleanStringLiteral(expr.toString()))
            .orElse("");
    }

    private Expression firstElement(Expression expr) {
        if (expr instanceof ArrayInitializerExpr array && !array.getValues().isEmpty()) {
            return array.getValues().get(0);
        }
        return expr;
    }

    private String combinePaths(String basePath, String methodPath) {
        String base = basePath == null ? "" : basePath.trim();
        String sub = methodPath == null ? "" : methodPath.trim();

        if (base.endsWith(PATH_SEPARATOR)) {
            base = base.substring(0, base.length() - 1);
        }
        if (!base.isEmpty() && !base.startsWith(PATH_SEPARATOR)) {
            base = PATH_SEPARATOR + base;
        }
        if (!sub.isEmpty() && !sub.startsWith(PATH_SEPARATOR)) {
            sub = PATH_SEPARATOR + sub;
        }

        String combined = base + sub;
        return combined.isEmpty() ? PATH_SEPARATOR : combined;
    }

    private EndpointParameter toParameter(Parameter param) {
        String type = param.getType().asString();
        boolean required = true;

        Optional<AnnotationExpr> requestParam = findAnnotation(param, "RequestParam");
        if (requestParam.isPresent()) {
            Optional<Expression> requiredAttr = getAnnotationAttribute(requestParam.get(), "required");
            if (requiredAttr.isPresent() && requiredAttr.get() instanceof BooleanLiteralExpr bool && !bool.getValue()) {
                required = false;
            }
            if (getAnnotationAttribute(requestParam.get(), "defaultValue").isPresent()) {
                required = false;
            }
        }
        if (param.getType() instanceof ClassOrInterfaceType classType
                && OPTIONAL_TYPES.contains(classType.getNameAsString())) {
            required = false;
        }

        return new EndpointParameter(param.getNameAsString(), type, required);
    }

    private EndpointResponse toResponse(MethodDeclaration method) {
        int status = responseStatus(method);
        Type type = method.getType();

        if (type instanceof ClassOrInterfaceType classType && "ResponseEntity".equals(classType.getNameAsString())) {
            Optional<Type> body = classType.getTypeArguments()
                .filter(args -> !args.isEmpty())
                .map(args -> args.get(0));
            if (body.isEmpty() || body.get().isWildcardType()) {
                return EndpointResponse.unknown(status);
            }
            type = body.get();
        }

        if (type.isVoidType() || "Void".equals(type.asString())) {
            return EndpointResponse.unknown(status);
        }
        if (type.isArrayType()) {
            return EndpointResponse.array(status, type.asArrayType().getComponentType().asString());
        }
        if (type instanceof ClassOrInterfaceType classType && COLLECTION_TYPES.contains(classType.getNameAsString())) {
            String items = classType.getTypeArguments()
                .filter(args -> !args.isEmpty())
                .map(args -> args.get(0).asString())
                .orElse("Object");
            return EndpointResponse.array(status, items);
        }
        return EndpointResponse.object(status, type.asString());
    }

    private int responseStatus(MethodDeclaration method) {
        Optional<AnnotationExpr> annotation = findAnnotation(method, "ResponseStatus");
        if (annotation.isEmpty()) {
            return DEFAULT_STATUS;
        }
        Optional<Expression> value = getAnnotationAttribute(annotation.get(), "value")
            .or(() -> getAnnotationAttribute(annotation.get(), "code"));
        if (value.isEmpty()) {
            return DEFAULT_STATUS;
        }
        if (value.get() instanceof IntegerLiteralExpr literal) {
            return literal.asNumber().intValue();
        }
        String text = value.get().toString();
        return HTTP_STATUS_CODES.getOrDefault(text.substring(text.lastIndexOf('.') + 1), DEFAULT_STATUS);
    }

    // ==================== Models ====================

    private Map<String, ModelDefinition> extractModels(CompilationUnit cu) {
        Map<String, ModelDefinition> models = new LinkedHashMap<>();

        cu.findAll(RecordDeclaration.class).forEach(recordDecl -> {
            List<ModelField> fields = recordDecl.getParameters().stream()
                .map(component -> new ModelField(component.getNameAsString(), component.getType().asString()))
                .toList();
            models.putIfAbsent(recordDecl.getNameAsString(), new ModelDefinition(fields));
        });

        cu.findAll(ClassOrInterfaceDeclaration.class).stream()
            .filter(classDecl -> !classDecl.isInterface())
            .filter(this::isMarkedModel)
            .forEach(classDecl -> {
                List<ModelField> fields = new ArrayList<>();
                for (FieldDeclaration field : classDecl.getFields()) {
                    if (field.isStatic()) {
                        continue;
                    }
                    field.getVariables().forEach(variable ->
                        fields.add(new ModelField(variable.getNameAsString(), variable.getType().asString())));
                }
                models.putIfAbsent(classDecl.getNameAsString(), new ModelDefinition(fields));
            });

        return models;
    }

    private boolean isMarkedModel(ClassOrInterfaceDeclaration classDecl) {
        return classDecl.getExtendedTypes().stream()
                .anyMatch(type -> MODEL_MARKERS.contains(type.getNameAsString()))
            || classDecl.getImplementedTypes().stream()
                .anyMatch(type -> MODEL_MARKERS.contains(type.getNameAsString()));
    }
}
