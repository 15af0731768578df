package tech.andrefsramos.schedule_diff.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/*
 * Motivo pelo qual uma sessão entrou no delta. Além de NONE e VIDEO (emitidos por este serviço),
 * aceita e preserva tipos definidos por quem chama, como "details".
 */
public record UpdateKind(String value) {

    public static final UpdateKind NONE = new UpdateKind("");
    public static final UpdateKind VIDEO = new UpdateKind("video");

    public UpdateKind {
        value = value == null ? "" : value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static UpdateKind of(String value) {
        if (value == null || value.isEmpty()) return NONE;
        if (VIDEO.value.equals(value)) return VIDEO;
        return new UpdateKind(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    public boolean isNone() {
        return value.isEmpty();
    }

    @Override
    public String toString() {
        return isNone() ? "NONE" : value;
    }
}
