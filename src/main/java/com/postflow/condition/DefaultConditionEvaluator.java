package com.postflow.condition;

import com.postflow.condition.impl.ComparisonCondition;
import com.postflow.condition.impl.ContainsCondition;
import com.postflow.condition.impl.EndsWithCondition;
import com.postflow.condition.impl.EqualsCondition;
import com.postflow.condition.impl.ExistsCondition;
import com.postflow.condition.impl.ExtensionInCondition;
import com.postflow.condition.impl.HasTagCondition;
import com.postflow.condition.impl.NotCondition;
import com.postflow.condition.impl.RegexCondition;
import com.postflow.condition.impl.StartsWithCondition;
import com.postflow.exception.ConfigurationException;
import com.postflow.rule.ConditionSpec;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

import java.util.List;

/**
 * Default implementation of ConditionEvaluator.
 * Factory that creates Condition instances from compiled rule conditions.
 * Parameters were validated by the compiler, so only their presence is re-checked here.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    private final VariableResolver variableResolver;

    public DefaultConditionEvaluator(VariableResolver variableResolver) {
        this.variableResolver = variableResolver;
    }

    @Override
    public Condition create(ConditionSpec spec) {
        if (spec == null) {
            throw new ConfigurationException("Condition cannot be null");
        }

        ConditionType type = spec.type();
        return switch (type) {
            case EQUALS -> new EqualsCondition(field(spec), value(spec), variableResolver);
            case NOT_EQUALS -> new NotCondition(
                    new EqualsCondition(field(spec), value(spec), variableResolver), type);

            case GREATER_THAN, LESS_THAN -> new ComparisonCondition(
                    field(spec), numericValue(spec), type, variableResolver);

            case CONTAINS -> new ContainsCondition(field(spec), value(spec), variableResolver);
            case NOT_CONTAINS -> new NotCondition(
                    new ContainsCondition(field(spec), value(spec), variableResolver), type);
            case STARTS_WITH -> new StartsWithCondition(field(spec), spec.stringParam("value"), variableResolver);
            case ENDS_WITH -> new EndsWithCondition(field(spec), spec.stringParam("value"), variableResolver);
            case REGEX_MATCH -> new RegexCondition(field(spec), required(spec, "pattern").toString(),
                    variableResolver);

            case EXISTS -> new ExistsCondition(field(spec), variableResolver);
            case HAS_TAG -> new HasTagCondition(required(spec, "tag").toString(), variableResolver);
            case EXTENSION_IN -> new ExtensionInCondition(stringList(spec, "extensions"), variableResolver);
        };
    }

    private static String field(ConditionSpec spec) {
        return required(spec, "field").toString();
    }

    private static Object value(ConditionSpec spec) {
        return required(spec, "value");
    }

    private static Number numericValue(ConditionSpec spec) {
        if (!(required(spec, "value") instanceof Number number)) {
            throw new ConfigurationException(spec.type().wireName() + " condition requires a numeric value");
        }
        return number;
    }

    private static List<String> stringList(ConditionSpec spec, String name) {
        if (!(required(spec, name) instanceof List<?> list)) {
            throw new ConfigurationException(spec.type().wireName() + " condition requires a list for " + name);
        }
        return list.stream().map(Object::toString).toList();
    }

    private static Object required(ConditionSpec spec, String name) {
        Object value = spec.params().get(name);
        if (value == null) {
            throw new ConfigurationException(spec.type().wireName() + " condition requires " + name);
        }
        return value;
    }
}
