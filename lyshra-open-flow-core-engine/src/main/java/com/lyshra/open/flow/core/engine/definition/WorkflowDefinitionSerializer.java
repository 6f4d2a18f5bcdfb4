package com.lyshra.open.flow.core.engine.definition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lyshra.open.flow.core.engine.trigger.condition.ConditionParser;
import com.lyshra.open.flow.core.util.CastUtil;
import com.lyshra.open.flow.integration.contract.definition.IConfigDocument;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;
import com.lyshra.open.flow.integration.contract.workflow.IStageDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowResourceKind;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageHandoff;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageKind;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowTriggerRuleType;
import com.lyshra.open.flow.integration.models.config.ConfigDocument;
import com.lyshra.open.flow.integration.models.trigger.TriggerAction;
import com.lyshra.open.flow.integration.models.trigger.TriggerRule;
import com.lyshra.open.flow.integration.models.workflows.StageDefinition;
import com.lyshra.open.flow.integration.models.workflows.WorkflowDefinition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes definition documents in YAML or JSON.
 *
 * <pre>{@code
 * kind: workflow
 * metadata:
 *   name: train_all
 *   annotations:
 *     group: models
 * spec:
 *   stages:
 *     - name: load
 *       target: data.load
 *     - name: train
 *       target: models.train
 *       type: parameterized
 *       depends_on: [load]
 *       resources: {cpus: 1}
 * }</pre>
 *
 * Trigger rules use {@code kind: trigger_rule} with {@code spec.type}, {@code spec.rule} (a
 * condition document or a list of cron expressions) and {@code spec.action}. Config documents
 * use {@code kind: config} with {@code spec.selector} and {@code spec.data}.
 */
@Slf4j
public final class WorkflowDefinitionSerializer {

    public static final String KIND_WORKFLOW = "workflow";
    public static final String KIND_TRIGGER_RULE = "trigger_rule";
    public static final String KIND_CONFIG = "config";

    private static final String STAGE_TYPE_SIMPLE = "simple";
    private static final String STAGE_TYPE_PARAMETERIZED = "parameterized";
    private static final String ANNOTATION_GROUP = "group";

    private static final ObjectMapper JSON_MAPPER;
    private static final ObjectMapper YAML_MAPPER;

    static {
        JSON_MAPPER = new ObjectMapper();
        configureMapper(JSON_MAPPER);

        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        YAML_MAPPER = new ObjectMapper(yamlFactory);
        configureMapper(YAML_MAPPER);
    }

    private static void configureMapper(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setDefaultPropertyInclusion(JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.NON_NULL));
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private WorkflowDefinitionSerializer() {
        // Utility class
    }

    public static String toYaml(Object resource) {
        return write(YAML_MAPPER, resource, "YAML");
    }

    public static String toJson(Object resource) {
        return write(JSON_MAPPER, resource, "JSON");
    }

    /**
     * Reads one document and returns an {@link IWorkflowDefinition}, {@link ITriggerRule} or
     * {@link IConfigDocument} according to its {@code kind}.
     */
    public static Object fromYaml(String yaml) {
        return mapToResource(read(YAML_MAPPER, yaml, "YAML"));
    }

    public static Object fromJson(String json) {
        return mapToResource(read(JSON_MAPPER, json, "JSON"));
    }

    public static IWorkflowDefinition workflowFromYaml(String yaml) {
        return expect(fromYaml(yaml), IWorkflowDefinition.class);
    }

    public static ITriggerRule triggerRuleFromYaml(String yaml) {
        return expect(fromYaml(yaml), ITriggerRule.class);
    }

    public static LyshraOpenFlowResourceKind kindOf(Object resource) {
        if (resource instanceof IWorkflowDefinition) {
            return LyshraOpenFlowResourceKind.WORKFLOW;
        }
        if (resource instanceof ITriggerRule) {
            return LyshraOpenFlowResourceKind.TRIGGER_RULE;
        }
        if (resource instanceof IConfigDocument) {
            return LyshraOpenFlowResourceKind.CONFIG;
        }
        throw new IllegalArgumentException("Unsupported definition type " + resource.getClass().getName());
    }

    public static Map<String, Object> resourceToMap(Object resource) {
        switch (kindOf(resource)) {
            case WORKFLOW:
                return workflowToMap((IWorkflowDefinition) resource);
            case TRIGGER_RULE:
                return triggerRuleToMap((ITriggerRule) resource);
            default:
                return configToMap((IConfigDocument) resource);
        }
    }

    public static Object mapToResource(Map<String, Object> document) {
        String kind = CastUtil.castAsString(document.get("kind"));
        if (kind == null) {
            throw new IllegalArgumentException("Definition document has no kind");
        }
        switch (kind) {
            case KIND_WORKFLOW:
                return mapToWorkflow(document);
            case KIND_TRIGGER_RULE:
                return mapToTriggerRule(document);
            case KIND_CONFIG:
                return mapToConfig(document);
            default:
                throw new IllegalArgumentException("Unknown definition kind [" + kind + "]");
        }
    }

    // ---------------------------------------------------------------- workflows

    public static Map<String, Object> workflowToMap(IWorkflowDefinition workflow) {
        Map<String, Object> metadata = metadata(workflow.getName(), workflow.getDescription());
        if (workflow.getConfigGroup() != null) {
            metadata.put("annotations", Map.of(ANNOTATION_GROUP, workflow.getConfigGroup()));
        }
        List<Map<String, Object>> stages = new ArrayList<>();
        for (IStageDefinition stage : workflow.getStages()) {
            stages.add(stageToMap(stage));
        }
        return document(KIND_WORKFLOW, metadata, Map.of("stages", stages));
    }

    public static IWorkflowDefinition mapToWorkflow(Map<String, Object> document) {
        Map<String, Object> metadata = section(document, "metadata");
        Map<String, Object> annotations = section(metadata, "annotations");
        Map<String, Object> spec = section(document, "spec");
        List<IStageDefinition> stages = new ArrayList<>();
        for (Object stage : list(spec.get("stages"), "spec.stages")) {
            stages.add(mapToStage(asMap(stage, "stage")));
        }
        return WorkflowDefinition.builder()
                .name(CastUtil.castAsString(metadata.get("name")))
                .description(CastUtil.castAsString(metadata.get("description")))
                .configGroup(CastUtil.castAsString(annotations.get(ANNOTATION_GROUP)))
                .stages(builder -> {
                    stages.forEach(builder::stage);
                    return builder;
                })
                .build();
    }

    private static Map<String, Object> stageToMap(IStageDefinition stage) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", stage.getName());
        map.put("description", stage.getDescription());
        map.put("target", stage.getTarget());
        map.put("type", stage.getKind() == LyshraOpenFlowStageKind.PARAMETERIZED ? STAGE_TYPE_PARAMETERIZED : STAGE_TYPE_SIMPLE);
        if (!stage.getDependsOn().isEmpty()) {
            map.put("depends_on", stage.getDependsOn());
        }
        if (!stage.getResources().isEmpty()) {
            map.put("resources", stage.getResources());
        }
        map.put("map_on", stage.getMapOn());
        map.put("timeout", stage.getTimeout() == null ? null : stage.getTimeout().toString());
        if (stage.getHandoff() == LyshraOpenFlowStageHandoff.OBJECT_STORE) {
            map.put("handoff", "object_store");
        }
        if (stage.isCollector()) {
            map.put("collector", true);
        }
        return map;
    }

    private static IStageDefinition mapToStage(Map<String, Object> map) {
        StageDefinition.OptionsStep builder = StageDefinition.builder()
                .name(CastUtil.castAsString(map.get("name")))
                .target(CastUtil.castAsString(map.get("target")))
                .description(CastUtil.castAsString(map.get("description")))
                .kind(stageKind(CastUtil.castAsString(map.get("type"))))
                .mapOn(CastUtil.castAsString(map.get("map_on")))
                .collector(Boolean.TRUE.equals(map.get("collector")));
        for (Object dependency : list(map.getOrDefault("depends_on", List.of()), "depends_on")) {
            builder.dependsOn(CastUtil.castAsString(dependency));
        }
        asMap(map.getOrDefault("resources", Map.of()), "resources")
                .forEach((label, amount) -> builder.resource(label, CastUtil.castAsBigDecimal(amount).doubleValue()));
        String timeout = CastUtil.castAsString(map.get("timeout"));
        if (timeout != null) {
            builder.timeout(Duration.parse(timeout));
        }
        String handoff = CastUtil.castAsString(map.get("handoff"));
        if (handoff != null) {
            builder.handoff(LyshraOpenFlowStageHandoff.valueOf(handoff.toUpperCase(Locale.ROOT)));
        }
        return builder.build();
    }

    private static LyshraOpenFlowStageKind stageKind(String type) {
        if (type == null || type.equals(STAGE_TYPE_SIMPLE)) {
            return LyshraOpenFlowStageKind.NORMAL;
        }
        if (type.equals(STAGE_TYPE_PARAMETERIZED)) {
            return LyshraOpenFlowStageKind.PARAMETERIZED;
        }
        throw new IllegalArgumentException("Unknown stage type [" + type + "]");
    }

    // ---------------------------------------------------------------- trigger rules

    public static Map<String, Object> triggerRuleToMap(ITriggerRule rule) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("type", rule.getType().name().toLowerCase(Locale.ROOT));
        spec.put("rule", rule.getType() == LyshraOpenFlowTriggerRuleType.CONDITION
                ? ConditionParser.toDocument(rule.getCondition())
                : rule.getSchedules());
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("target", rule.getAction().getTarget());
        action.put("parameters", rule.getAction().getParameters());
        spec.put("action", action);
        return document(KIND_TRIGGER_RULE, metadata(rule.getName(), rule.getDescription()), spec);
    }

    public static ITriggerRule mapToTriggerRule(Map<String, Object> document) {
        Map<String, Object> metadata = section(document, "metadata");
        Map<String, Object> spec = section(document, "spec");
        Map<String, Object> action = section(spec, "action");
        String type = CastUtil.castAsString(spec.getOrDefault("type", "condition"));
        LyshraOpenFlowTriggerRuleType ruleType = LyshraOpenFlowTriggerRuleType.valueOf(type.toUpperCase(Locale.ROOT));

        TriggerRule.TriggerRuleBuilder builder = TriggerRule.builder()
                .name(CastUtil.castAsString(metadata.get("name")))
                .description(CastUtil.castAsString(metadata.get("description")))
                .type(ruleType)
                .action(TriggerAction.builder()
                        .target(CastUtil.castAsString(action.get("target")))
                        .parameters(section(action, "parameters"))
                        .build());
        if (ruleType == LyshraOpenFlowTriggerRuleType.CONDITION) {
            builder.condition(ConditionParser.parse(asMap(spec.get("rule"), "spec.rule")));
        } else {
            for (Object schedule : list(spec.get("rule"), "spec.rule")) {
                builder.schedule(CastUtil.castAsString(schedule));
            }
        }
        return builder.build();
    }

    // ---------------------------------------------------------------- config

    public static Map<String, Object> configToMap(IConfigDocument config) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("selector", config.getSelector());
        spec.put("data", config.getData());
        return document(KIND_CONFIG, metadata(config.getName(), null), spec);
    }

    public static IConfigDocument mapToConfig(Map<String, Object> document) {
        Map<String, Object> metadata = section(document, "metadata");
        Map<String, Object> spec = section(document, "spec");
        return ConfigDocument.builder()
                .name(CastUtil.castAsString(metadata.get("name")))
                .selector(CastUtil.castAsString(spec.get("selector")))
                .data(section(spec, "data"))
                .build();
    }

    // ---------------------------------------------------------------- helpers

    private static Map<String, Object> document(String kind, Map<String, Object> metadata, Map<String, Object> spec) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("kind", kind);
        document.put("metadata", metadata);
        document.put("spec", spec);
        return document;
    }

    private static Map<String, Object> metadata(String name, String description) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", name);
        metadata.put("description", description);
        return metadata;
    }

    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object value = parent.get(key);
        return value == null ? Map.of() : asMap(value, key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Expected a map for [" + what + "] but found " + value);
        }
        return (Map<String, Object>) value;
    }

    private static List<?> list(Object value, String what) {
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("Expected a list for [" + what + "] but found " + value);
        }
        return list;
    }

    private static <T> T expect(Object resource, Class<T> type) {
        if (!type.isInstance(resource)) {
            throw new IllegalArgumentException("Expected a " + type.getSimpleName() + " document but found "
                    + resource.getClass().getSimpleName());
        }
        return type.cast(resource);
    }

    private static String write(ObjectMapper mapper, Object resource, String format) {
        try {
            return mapper.writeValueAsString(resourceToMap(resource));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize definition to {}: {}", format, e.getMessage(), e);
            throw new IllegalArgumentException("Failed to serialize definition to " + format, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> read(ObjectMapper mapper, String content, String format) {
        try {
            return mapper.readValue(content, Map.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize definition from {}: {}", format, e.getMessage(), e);
            throw new IllegalArgumentException("Failed to deserialize definition from " + format, e);
        }
    }
}
