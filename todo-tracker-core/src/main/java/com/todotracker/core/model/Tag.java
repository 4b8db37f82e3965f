package com.todotracker.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * A technical-debt marker keyword.
 *
 * <p>The five built-in markers have their own {@link Kind}; anything else supplied through
 * configuration is a {@link Kind#CUSTOM} tag carrying its own name.
 *
 * @param kind built-in kind, or {@link Kind#CUSTOM}
 * @param name tag text as reported, spelled as it was declared
 */
public record Tag(Kind kind, String name) {

    public static final Tag TODO = new Tag(Kind.TODO, "TODO");
    public static final Tag FIXME = new Tag(Kind.FIXME, "FIXME");
    public static final Tag HACK = new Tag(Kind.HACK, "HACK");
    public static final Tag BUG = new Tag(Kind.BUG, "BUG");
    public static final Tag XXX = new Tag(Kind.XXX, "XXX");

    /**
     * Tag kinds. A tag whose name equals a built-in name ignoring case has that kind.
     */
    public enum Kind {
        TODO,
        FIXME,
        HACK,
        BUG,
        XXX,
        CUSTOM
    }

    public Tag {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    /**
     * Resolves tag text to a tag, keeping its spelling.
     *
     * <p>Upper-case built-in names map to their constants. Other spellings of a built-in
     * name keep the built-in kind but report the text as given; anything else is custom.
     *
     * @param text tag text as it appeared in source or configuration
     * @return built-in tag, or a tag keeping the original text
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Tag of(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Tag builtIn = switch (text.toUpperCase(Locale.ROOT)) {
            case "TODO" -> TODO;
            case "FIXME" -> FIXME;
            case "HACK" -> HACK;
            case "BUG" -> BUG;
            case "XXX" -> XXX;
            default -> null;
        };
        if (builtIn == null) {
            return new Tag(Kind.CUSTOM, text);
        }
        return builtIn.name.equals(text) ? builtIn : new Tag(builtIn.kind, text);
    }

    public boolean isCustom() {
        return kind == Kind.CUSTOM;
    }

    @JsonValue
    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
