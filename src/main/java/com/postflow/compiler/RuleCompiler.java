package com.postflow.compiler;

import com.postflow.rule.ActionSpec;
import com.postflow.rule.ActionType;
import com.postflow.rule.ActiveHours;
import com.postflow.rule.ConditionSpec;
import com.postflow.rule.ConditionType;
import com.postflow.rule.GuardrailSpec;
import com.postflow.rule.GuardrailType;
import com.postflow.rule.ParamKind;
import com.postflow.rule.ParamSpec;
import com.postflow.rule.RegisteredType;
import com.postflow.rule.Rule;
import com.postflow.rule.TriggerType;
import com.postflow.rule.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles declarative rule documents into validated, canonical {@link Rule}s.
 * <p>
 * Compilation is pure: the same document, whatever its key order, always yields the same
 * canonical form and hash. Validation never stops at the first problem; every error is
 * reported with its field path.
 */
public class RuleCompiler {

    private static final Logger log = LoggerFactory.getLogger(RuleCompiler.class);

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 100;
    public static final int DEFAULT_PRIORITY = 50;

    private static final Set<String> DOCUMENT_KEYS = Set.of(
            "id", "name", "description", "enabled", "priority", "quiet_period_sec",
            "active_hours", "trigger", "conditions", "actions", "guardrails", "tags");
    private static final Set<String> ENTRY_KEYS = Set.of("type", "params");
    private static final Set<String> ACTIVE_HOURS_KEYS = Set.of("enabled", "start", "end", "days");

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;

    public RuleCompiler() {
        this(Clock.systemUTC());
    }

    public RuleCompiler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Compile a rule document.
     *
     * @param document Raw document, as parsed from YAML or JSON
     * @return The compiled rule, or all validation errors
     */
    public CompilationResult compile(Map<String, ?> document) {
        List<ValidationError> errors = new ArrayList<>();
        if (document == null) {
            errors.add(new ValidationError("$", "document is required"));
            return CompilationResult.failure(errors);
        }

        for (String key : new TreeSet<>(document.keySet())) {
            if (!DOCUMENT_KEYS.contains(key)) {
                errors.add(new ValidationError(key, "unknown field"));
            }
        }

        String id = optionalString(document, "id", errors);
        if (id != null && id.isBlank()) {
            errors.add(new ValidationError("id", "must not be blank"));
        }
        String name = optionalString(document, "name", errors);
        if (name == null || name.isBlank()) {
            errors.add(new ValidationError("name", "is required"));
        }
        String description = optionalString(document, "description", errors);
        boolean enabled = optionalBoolean(document, "enabled", true, "enabled", errors);

        int priority = optionalInt(document, "priority", DEFAULT_PRIORITY, errors);
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            errors.add(new ValidationError("priority",
                    "must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY));
        }
        int quietPeriodSec = optionalInt(document, "quiet_period_sec", 0, errors);
        if (quietPeriodSec < 0) {
            errors.add(new ValidationError("quiet_period_sec", "must not be negative"));
        }

        TriggerType trigger = parseTrigger(document.get("trigger"), errors);

        List<ConditionSpec> conditions = parseEntries(document.get("conditions"), "conditions",
                ConditionType.class, false, errors,
                (entry) -> new ConditionSpec(entry.type(), entry.params()));
        List<ActionSpec> actions = parseEntries(document.get("actions"), "actions",
                ActionType.class, true, errors,
                (entry) -> new ActionSpec(entry.type(), entry.params()));
        List<GuardrailSpec> guardrails = parseEntries(document.get("guardrails"), "guardrails",
                GuardrailType.class, false, errors,
                (entry) -> new GuardrailSpec(entry.type(), entry.params()));

        ActiveHours activeHours = parseActiveHours(document.get("active_hours"), errors);
        List<String> tags = parseTags(document.get("tags"), errors);

        if (!errors.isEmpty()) {
            log.debug("Rule document '{}' rejected with {} errors", name, errors.size());
            return CompilationResult.failure(errors);
        }

        Map<String, Object> normalized = new TreeMap<>();
        if (id != null) {
            normalized.put("id", id);
        }
        normalized.put("name", name);
        normalized.put("description", description != null ? description : "");
        normalized.put("enabled", enabled);
        normalized.put("priority", priority);
        normalized.put("quiet_period_sec", quietPeriodSec);
        normalized.put("trigger", trigger.wireName());
        normalized.put("conditions", conditions.stream()
                .map(c -> entryDocument(c.type(), c.params())).toList());
        normalized.put("actions", actions.stream()
                .map(a -> entryDocument(a.type(), a.params())).toList());
        normalized.put("guardrails", guardrails.stream()
                .map(g -> entryDocument(g.type(), g.params())).toList());
        if (activeHours != null) {
            normalized.put("active_hours", activeHoursDocument(activeHours));
        }
        normalized.put("tags", tags);

        String canonical = CanonicalForm.write(normalized);
        String hash = CanonicalForm.sha256(canonical);
        String ruleId = id != null ? id : "rule-" + hash.substring(0, 12);

        Rule rule = new Rule(ruleId, name, description != null ? description : "", enabled, priority,
                trigger, conditions, actions, guardrails, quietPeriodSec, activeHours, tags,
                canonical, hash, clock.instant());
        log.debug("Compiled rule '{}' ({}) hash={}", name, ruleId, hash);
        return CompilationResult.success(rule);
    }

    /**
     * Compile a rule document, throwing on validation errors.
     *
     * @throws com.postflow.exception.RuleCompilationException carrying every validation error
     */
    public Rule compileOrThrow(Map<String, ?> document) {
        return compile(document).orElseThrow();
    }

    // Top-level fields

    private TriggerType parseTrigger(Object raw, List<ValidationError> errors) {
        boolean nested = raw instanceof Map<?, ?>;
        String path = nested ? "trigger.type" : "trigger";
        Object typeValue = nested ? ((Map<?, ?>) raw).get("type") : raw;
        if (typeValue == null) {
            errors.add(new ValidationError(path, "is required"));
            return null;
        }
        if (!(typeValue instanceof String typeName)) {
            errors.add(new ValidationError(path, "must be a string"));
            return null;
        }
        return TriggerType.fromWireName(typeName).orElseGet(() -> {
            errors.add(new ValidationError(path, "unknown trigger type '" + typeName + "', expected one of "
                    + Arrays.stream(TriggerType.values()).map(TriggerType::wireName).toList()));
            return null;
        });
    }

    private List<String> parseTags(Object raw, List<ValidationError> errors) {
        if (raw == null) {
            return List.of();
        }
        if (!ParamKind.STRING_ARRAY.accepts(raw)) {
            errors.add(new ValidationError("tags", "must be an array of strings"));
            return List.of();
        }
        return ((List<?>) raw).stream().map(Object::toString).toList();
    }

    private ActiveHours parseActiveHours(Object raw, List<ValidationError> errors) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            errors.add(new ValidationError("active_hours", "must be an object"));
            return null;
        }
        for (Object key : map.keySet()) {
            if (!ACTIVE_HOURS_KEYS.contains(String.valueOf(key))) {
                errors.add(new ValidationError("active_hours." + key, "unknown field"));
            }
        }
        boolean enabled = optionalBoolean(map, "enabled", true, "active_hours.enabled", errors);
        if (!enabled) {
            return ActiveHours.disabled();
        }

        LocalTime start = parseTime(map.get("start"), "active_hours.start", errors);
        LocalTime end = parseTime(map.get("end"), "active_hours.end", errors);
        if (start != null && start.equals(end)) {
            errors.add(new ValidationError("active_hours.end", "must differ from start"));
        }

        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        Object rawDays = map.get("days");
        if (!(rawDays instanceof List<?> dayList) || dayList.isEmpty()) {
            errors.add(new ValidationError("active_hours.days", "must be a non-empty array of weekdays 1-7"));
        } else {
            for (int i = 0; i < dayList.size(); i++) {
                Object day = dayList.get(i);
                if (day instanceof Number n && fitsInt(n) && n.intValue() >= 1 && n.intValue() <= 7) {
                    days.add(DayOfWeek.of(n.intValue()));
                } else {
                    errors.add(new ValidationError("active_hours.days[" + i + "]",
                            "must be a weekday number between 1 (Monday) and 7 (Sunday)"));
                }
            }
        }

        if (start == null || end == null || days.isEmpty()) {
            return null;
        }
        return new ActiveHours(true, start, end, days);
    }

    private LocalTime parseTime(Object raw, String path, List<ValidationError> errors) {
        if (raw == null) {
            errors.add(new ValidationError(path, "is required"));
            return null;
        }
        try {
            return LocalTime.parse(raw.toString(), TIME_FORMAT);
        } catch (DateTimeParseException e) {
            errors.add(new ValidationError(path, "must be a time formatted HH:mm"));
            return null;
        }
    }

    // Typed entries (conditions, actions, guardrails)

    private <E extends Enum<E> & RegisteredType, S> List<S> parseEntries(
            Object raw,
            String path,
            Class<E> registry,
            boolean atLeastOne,
            List<ValidationError> errors,
            Function<Entry<E>, S> factory) {
        if (raw == null) {
            if (atLeastOne) {
                errors.add(new ValidationError(path, "at least one entry is required"));
            }
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            errors.add(new ValidationError(path, "must be an array"));
            return List.of();
        }
        if (atLeastOne && list.isEmpty()) {
            errors.add(new ValidationError(path, "at least one entry is required"));
        }

        List<S> specs = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Entry<E> entry = parseEntry(list.get(i), path + "[" + i + "]", registry, errors);
            if (entry != null) {
                specs.add(factory.apply(entry));
            }
        }
        return specs;
    }

    private <E extends Enum<E> & RegisteredType> Entry<E> parseEntry(
            Object raw, String path, Class<E> registry, List<ValidationError> errors) {
        if (!(raw instanceof Map<?, ?> map)) {
            errors.add(new ValidationError(path, "must be an object with 'type' and 'params'"));
            return null;
        }
        for (Object key : map.keySet()) {
            if (!ENTRY_KEYS.contains(String.valueOf(key))) {
                errors.add(new ValidationError(path + "." + key, "unknown field"));
            }
        }

        Object typeValue = map.get("type");
        if (!(typeValue instanceof String typeName)) {
            errors.add(new ValidationError(path + ".type", "is required"));
            return null;
        }
        E type = RegisteredType.fromWireName(registry, typeName).orElse(null);
        if (type == null) {
            errors.add(new ValidationError(path + ".type", "unknown type '" + typeName + "', expected one of "
                    + Arrays.stream(registry.getEnumConstants()).map(RegisteredType::wireName).toList()));
            return null;
        }

        Object rawParams = map.get("params");
        if (rawParams != null && !(rawParams instanceof Map<?, ?>)) {
            errors.add(new ValidationError(path + ".params", "must be an object"));
            return null;
        }
        Map<?, ?> params = rawParams != null ? (Map<?, ?>) rawParams : Map.of();

        int errorsBefore = errors.size();
        Map<String, Object> validated = validateParams(type, params, path + ".params", errors);
        validateSemantics(type, validated, path + ".params", errors);
        return errors.size() == errorsBefore ? new Entry<>(type, validated) : null;
    }

    private Map<String, Object> validateParams(RegisteredType type, Map<?, ?> params,
                                               String path, List<ValidationError> errors) {
        Map<String, Object> validated = new TreeMap<>();
        for (Object key : params.keySet()) {
            if (type.param(String.valueOf(key)).isEmpty()) {
                errors.add(new ValidationError(path + "." + key,
                        "unknown parameter for " + type.wireName()));
            }
        }
        for (ParamSpec spec : type.params()) {
            String paramPath = path + "." + spec.name();
            Object value = params.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    errors.add(new ValidationError(paramPath, "is required for " + type.wireName()));
                }
                continue;
            }
            if (!spec.kind().accepts(value)) {
                errors.add(new ValidationError(paramPath, "must be " + spec.kind().description()));
                continue;
            }
            if (spec.kind() == ParamKind.ENUM && !spec.allowedValues().contains(value.toString())) {
                errors.add(new ValidationError(paramPath, "must be one of " + spec.allowedValues()));
                continue;
            }
            if (value instanceof Number n && !Double.isFinite(n.doubleValue())) {
                errors.add(new ValidationError(paramPath, "must be a finite number"));
                continue;
            }
            validated.put(spec.name(), normalize(value));
        }
        return validated;
    }

    private void validateSemantics(RegisteredType type, Map<String, Object> params,
                                   String path, List<ValidationError> errors) {
        if (type == ConditionType.REGEX_MATCH && params.get("pattern") instanceof String pattern) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                errors.add(new ValidationError(path + ".pattern", "is not a valid regular expression"));
            }
        }
        if (type instanceof GuardrailType
                && params.get(GuardrailType.RETRY_DELAY_PARAM) instanceof Number delay
                && delay.doubleValue() <= 0) {
            errors.add(new ValidationError(path + "." + GuardrailType.RETRY_DELAY_PARAM, "must be positive"));
        }
    }

    // Canonical documents

    private static Map<String, Object> entryDocument(RegisteredType type, Map<String, Object> params) {
        Map<String, Object> entry = new TreeMap<>();
        entry.put("type", type.wireName());
        entry.put("params", new TreeMap<>(params));
        return entry;
    }

    private static Map<String, Object> activeHoursDocument(ActiveHours activeHours) {
        Map<String, Object> doc = new TreeMap<>();
        doc.put("enabled", activeHours.enabled());
        if (activeHours.enabled()) {
            doc.put("start", activeHours.start().format(TIME_FORMAT));
            doc.put("end", activeHours.end().format(TIME_FORMAT));
            doc.put("days", activeHours.days().stream().map(DayOfWeek::getValue).sorted().toList());
        }
        return doc;
    }

    /**
     * Integral numbers become longs and others doubles, so 5, 5L and 5.0 hash the same.
     */
    private static Object normalize(Object value) {
        if (value instanceof Number n) {
            if (isIntegral(n)) {
                return n.longValue();
            }
            return n.doubleValue();
        }
        if (value instanceof List<?> list) {
            return List.copyOf(list);
        }
        return value;
    }

    // Helpers

    private static boolean isIntegral(Number n) {
        double d = n.doubleValue();
        return Double.isFinite(d) && d == Math.rint(d);
    }

    private static boolean fitsInt(Number n) {
        double d = n.doubleValue();
        return isIntegral(n) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE;
    }

    private static String optionalString(Map<?, ?> map, String key, List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            errors.add(new ValidationError(key, "must be a string"));
            return null;
        }
        return s;
    }

    private static boolean optionalBoolean(Map<?, ?> map, String key, boolean defaultValue,
                                           String path, List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean b)) {
            errors.add(new ValidationError(path, "must be a boolean"));
            return defaultValue;
        }
        return b;
    }

    private static int optionalInt(Map<?, ?> map, String key, int defaultValue, List<ValidationError> errors) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number n) || !isIntegral(n)) {
            errors.add(new ValidationError(key, "must be an integer"));
            return defaultValue;
        }
        if (!fitsInt(n)) {
            errors.add(new ValidationError(key, "is out of range: " + value));
            return defaultValue;
        }
        return n.intValue();
    }

    private record Entry<E>(E type, Map<String, Object> params) {
    }
}
