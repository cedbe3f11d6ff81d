package org.neuralchilli.pipeflow.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.pipeflow.domain.*;
import org.yaml.snakeyaml.Yaml;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Parses YAML definitions into control-plane objects.
 * A document's {@code kind} picks the object type; one file may hold several documents.
 */
@ApplicationScoped
public class YamlParser {

    public static final String PIPELINE = "Pipeline";
    public static final String TASK = "Task";
    public static final String CLUSTER_TASK = "ClusterTask";
    public static final String CONDITION = "Condition";
    public static final String PIPELINE_RESOURCE = "PipelineResource";
    public static final String PIPELINE_RUN = PipelineRun.KIND;

    private final Yaml yaml = new Yaml();

    /**
     * Parse every document of a YAML string. Empty documents are skipped.
     */
    @SuppressWarnings("unchecked")
    public List<ClusterObject<?>> parse(String yamlContent) {
        List<ClusterObject<?>> result = new ArrayList<>();
        for (Object document : yaml.loadAll(yamlContent)) {
            if (document == null) {
                continue;
            }
            if (!(document instanceof Map)) {
                throw new IllegalArgumentException("YAML document must be a mapping");
            }
            result.add(parseObject((Map<String, Object>) document));
        }
        return result;
    }

    ClusterObject<?> parseObject(Map<String, Object> data) {
        String kind = getString(data, "kind", true);
        Map<String, Object> spec = getMap(data, "spec");

        return switch (kind) {
            case PIPELINE -> new Pipeline(parseMetadata(data, false), parsePipelineSpec(spec));
            case TASK -> new Task(parseMetadata(data, false), parseTaskSpec(spec));
            case CLUSTER_TASK -> new ClusterTask(parseMetadata(data, true), parseTaskSpec(spec));
            case CONDITION -> new Condition(parseMetadata(data, false), parseConditionSpec(spec));
            case PIPELINE_RESOURCE -> new PipelineResource(parseMetadata(data, false), parseResourceSpec(spec));
            case PIPELINE_RUN -> new PipelineRun(parseMetadata(data, false), parseRunSpec(spec), null);
            default -> throw new IllegalArgumentException("Unsupported kind: " + kind);
        };
    }

    private ObjectMeta parseMetadata(Map<String, Object> data, boolean clusterScoped) {
        Map<String, Object> metadata = getMap(data, "metadata");
        String name = getString(metadata, "name", true);
        String namespace = clusterScoped ? "" : Objects.requireNonNullElse(getString(metadata, "namespace", false), "default");

        return ObjectMeta.of(namespace, name)
                .withLabels(getStringMap(metadata, "labels", Map.of()))
                .withAnnotations(getStringMap(metadata, "annotations", Map.of()));
    }

    // Pipelines

    PipelineSpec parsePipelineSpec(Map<String, Object> spec) {
        List<ResourceDeclaration> resources = getMapList(spec, "resources").stream()
                .map(this::parseResourceDeclaration)
                .toList();
        List<PipelineTask> tasks = getMapList(spec, "tasks").stream()
                .map(this::parsePipelineTask)
                .toList();
        List<PipelineResult> results = getMapList(spec, "results").stream()
                .map(r -> new PipelineResult(getString(r, "name", true), getString(r, "description", false),
                        getString(r, "value", true)))
                .toList();

        return new PipelineSpec(
                getString(spec, "description", false),
                resources,
                parseParamSpecs(spec),
                parseWorkspaceDeclarations(spec),
                tasks,
                results
        );
    }

    private PipelineTask parsePipelineTask(Map<String, Object> data) {
        String name = getString(data, "name", true);

        Map<String, Object> resources = getMap(data, "resources");
        PipelineTaskResources taskResources = new PipelineTaskResources(
                getMapList(resources, "inputs").stream().map(this::parseInputResource).toList(),
                getMapList(resources, "outputs").stream()
                        .map(o -> new PipelineTaskOutputResource(getString(o, "name", true), getString(o, "resource", true)))
                        .toList()
        );

        List<WorkspacePipelineTaskBinding> workspaces = getMapList(data, "workspaces").stream()
                .map(w -> new WorkspacePipelineTaskBinding(getString(w, "name", true),
                        getString(w, "workspace", true), getString(w, "subPath", false)))
                .toList();

        List<PipelineTaskCondition> conditions = getMapList(data, "conditions").stream()
                .map(c -> new PipelineTaskCondition(getString(c, "conditionRef", true), parseParams(c),
                        getMapList(c, "resources").stream().map(this::parseInputResource).toList()))
                .toList();

        return new PipelineTask(
                name,
                parseTaskRef(name, data),
                parseParams(data),
                taskResources,
                workspaces,
                conditions,
                getStringList(data, "runAfter", List.of()),
                getDuration(data, "timeout"),
                getInt(data, "retries", 0)
        );
    }

    private TaskRef parseTaskRef(String pipelineTask, Map<String, Object> data) {
        if (data.containsKey("taskSpec")) {
            return TaskRef.inline(parseTaskSpec(getMap(data, "taskSpec")));
        }
        if (!data.containsKey("taskRef")) {
            throw new IllegalArgumentException("Pipeline task " + pipelineTask + " needs a taskRef or taskSpec");
        }
        Map<String, Object> ref = getMap(data, "taskRef");
        String name = getString(ref, "name", true);
        String kind = Objects.requireNonNullElse(getString(ref, "kind", false), TASK);
        return switch (kind) {
            case TASK -> TaskRef.named(name);
            case CLUSTER_TASK -> TaskRef.clusterScoped(name);
            default -> throw new IllegalArgumentException("Unsupported task kind: " + kind);
        };
    }

    private PipelineTaskInputResource parseInputResource(Map<String, Object> data) {
        return new PipelineTaskInputResource(getString(data, "name", true), getString(data, "resource", true),
                getStringList(data, "from", List.of()));
    }

    // Tasks and conditions

    TaskSpec parseTaskSpec(Map<String, Object> spec) {
        Map<String, Object> resources = getMap(spec, "resources");
        TaskResources taskResources = new TaskResources(
                getMapList(resources, "inputs").stream().map(this::parseResourceDeclaration).toList(),
                getMapList(resources, "outputs").stream().map(this::parseResourceDeclaration).toList()
        );
        List<Step> steps = getMapList(spec, "steps").stream().map(this::parseStep).toList();
        List<TaskResultDeclaration> results = getMapList(spec, "results").stream()
                .map(r -> new TaskResultDeclaration(getString(r, "name", true), getString(r, "description", false)))
                .toList();

        return new TaskSpec(
                getString(spec, "description", false),
                parseParamSpecs(spec),
                taskResources,
                parseWorkspaceDeclarations(spec),
                steps,
                results
        );
    }

    private ConditionSpec parseConditionSpec(Map<String, Object> spec) {
        if (!spec.containsKey("check")) {
            throw new IllegalArgumentException("Missing required field: check");
        }
        return new ConditionSpec(
                parseStep(getMap(spec, "check")),
                parseParamSpecs(spec),
                getMapList(spec, "resources").stream().map(this::parseResourceDeclaration).toList(),
                getString(spec, "description", false)
        );
    }

    private Step parseStep(Map<String, Object> data) {
        return new Step(
                getString(data, "name", false),
                getString(data, "image", false),
                getStringList(data, "command", List.of()),
                getStringList(data, "args", List.of()),
                getString(data, "script", false)
        );
    }

    private ResourceDeclaration parseResourceDeclaration(Map<String, Object> data) {
        return new ResourceDeclaration(
                getString(data, "name", true),
                ResourceType.fromValue(getString(data, "type", true)),
                getBoolean(data, "optional", false)
        );
    }

    private List<WorkspaceDeclaration> parseWorkspaceDeclarations(Map<String, Object> spec) {
        return getMapList(spec, "workspaces").stream()
                .map(w -> new WorkspaceDeclaration(getString(w, "name", true), getString(w, "description", false),
                        getString(w, "mountPath", false), getBoolean(w, "optional", false)))
                .toList();
    }

    // Resources

    private PipelineResourceSpec parseResourceSpec(Map<String, Object> spec) {
        Map<String, String> params = new LinkedHashMap<>();
        getMapList(spec, "params").forEach(p -> params.put(getString(p, "name", true), getString(p, "value", true)));
        return new PipelineResourceSpec(
                ResourceType.fromValue(getString(spec, "type", true)),
                params,
                getString(spec, "description", false)
        );
    }

    // Runs

    PipelineRunSpec parseRunSpec(Map<String, Object> spec) {
        String pipelineRef = spec.containsKey("pipelineRef") ? getString(getMap(spec, "pipelineRef"), "name", true) : null;
        PipelineSpec pipelineSpec = spec.containsKey("pipelineSpec") ? parsePipelineSpec(getMap(spec, "pipelineSpec")) : null;

        List<PipelineResourceBinding> resources = getMapList(spec, "resources").stream()
                .map(this::parseResourceBinding)
                .toList();
        List<TaskServiceAccount> serviceAccounts = getMapList(spec, "serviceAccountNames").stream()
                .map(sa -> new TaskServiceAccount(getString(sa, "taskName", true), getString(sa, "serviceAccountName", true)))
                .toList();
        List<WorkspaceBinding> workspaces = getMapList(spec, "workspaces").stream()
                .map(this::parseWorkspaceBinding)
                .toList();

        return new PipelineRunSpec(
                pipelineRef,
                pipelineSpec,
                parseParams(spec),
                resources,
                getString(spec, "serviceAccountName", false),
                serviceAccounts,
                getDuration(spec, "timeout"),
                getString(spec, "status", false),
                workspaces
        );
    }

    private PipelineResourceBinding parseResourceBinding(Map<String, Object> data) {
        String name = getString(data, "name", true);
        if (data.containsKey("resourceSpec")) {
            return PipelineResourceBinding.inline(name, parseResourceSpec(getMap(data, "resourceSpec")));
        }
        return PipelineResourceBinding.ref(name, getString(getMap(data, "resourceRef"), "name", true));
    }

    private WorkspaceBinding parseWorkspaceBinding(Map<String, Object> data) {
        String name = getString(data, "name", true);
        String subPath = getString(data, "subPath", false);

        if (data.containsKey("persistentVolumeClaim")) {
            return WorkspaceBinding.claim(name, getString(getMap(data, "persistentVolumeClaim"), "claimName", true), subPath);
        }
        if (data.containsKey("emptyDir")) {
            return new WorkspaceBinding(name, subPath, null, true, null, null, null);
        }
        if (data.containsKey("volumeClaimTemplate")) {
            return WorkspaceBinding.template(name, parseClaimTemplate(getMap(data, "volumeClaimTemplate")), subPath);
        }
        if (data.containsKey("configMap")) {
            return new WorkspaceBinding(name, subPath, null, false, null,
                    getString(getMap(data, "configMap"), "name", true), null);
        }
        if (data.containsKey("secret")) {
            return new WorkspaceBinding(name, subPath, null, false, null, null,
                    getString(getMap(data, "secret"), "secretName", true));
        }
        throw new IllegalArgumentException("Workspace binding " + name + " must set a volume source");
    }

    private PersistentVolumeClaim parseClaimTemplate(Map<String, Object> data) {
        Map<String, Object> metadata = getMap(data, "metadata");
        Map<String, Object> spec = getMap(data, "spec");
        Map<String, Object> requests = getMap(getMap(spec, "resources"), "requests");

        String name = Objects.requireNonNullElse(getString(metadata, "name", false), "pvc");
        PersistentVolumeClaimSpec claimSpec = new PersistentVolumeClaimSpec(
                getStringList(spec, "accessModes", List.of()),
                getString(requests, "storage", true),
                getString(spec, "storageClassName", false)
        );
        return new PersistentVolumeClaim(ObjectMeta.of("", name), claimSpec);
    }

    // Params

    private List<ParamSpec> parseParamSpecs(Map<String, Object> spec) {
        return getMapList(spec, "params").stream()
                .map(p -> new ParamSpec(
                        getString(p, "name", true),
                        p.containsKey("type") ? ParamType.fromString(getString(p, "type", false)) : null,
                        getString(p, "description", false),
                        p.containsKey("default") ? toParamValue(p.get("default")) : null))
                .toList();
    }

    private List<Param> parseParams(Map<String, Object> data) {
        return getMapList(data, "params").stream()
                .map(p -> new Param(getString(p, "name", true), toParamValue(p.get("value"))))
                .toList();
    }

    private ParamValue toParamValue(Object value) {
        if (value instanceof List<?> list) {
            return ParamValue.ofArray(list.stream().map(Object::toString).collect(Collectors.toList()));
        }
        return ParamValue.ofString(value == null ? "" : value.toString());
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    /**
     * Accepts ISO-8601 ({@code PT1H}), a bare number of seconds, or a number with one of
     * the suffixes ms, s, m, h.
     */
    private Duration getDuration(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        String text = value.toString().trim();
        if (text.startsWith("P") || text.startsWith("p")) {
            return Duration.parse(text);
        }
        try {
            if (text.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2)));
            }
            if (text.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            if (text.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            if (text.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + text, e);
        }
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        return List.of(value.toString());
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key, Map<String, String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Map) {
            Map<String, String> result = new HashMap<>();
            ((Map<?, ?>) value).forEach((k, v) ->
                    result.put(k.toString(), v != null ? v.toString() : "")
            );
            return result;
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Field " + key + " must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Field " + key + " must be a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (List<Object>) value) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Entries of " + key + " must be mappings");
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }
}
