package com.postflow.rule;

import java.util.List;
import java.util.Optional;

/**
 * A type name that rule documents may reference, together with its parameter schema.
 */
public interface RegisteredType {

    /**
     * Version of the closed type registries. Bumped whenever a type or parameter is added or changed.
     */
    int REGISTRY_VERSION = 1;

    /**
     * Name used in rule documents (e.g. "pause_if_recording").
     */
    String wireName();

    /**
     * Parameters accepted by this type.
     */
    List<ParamSpec> params();

    default Optional<ParamSpec> param(String name) {
        return params().stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Look up a constant of a registry enum by its wire name.
     */
    static <E extends Enum<E> & RegisteredType> Optional<E> fromWireName(Class<E> type, String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.wireName().equals(wireName)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
