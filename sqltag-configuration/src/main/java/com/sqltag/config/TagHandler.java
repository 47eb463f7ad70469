package com.sqltag.config;

import com.sqltag.context.ReadableContext;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * How the value of one tag is resolved. One of three kinds:
 * <ul>
 *   <li>{@link Kind#STATIC}: a constant</li>
 *   <li>{@link Kind#PRODUCER}: a supplier called on every render</li>
 *   <li>{@link Kind#CONTEXT_PRODUCER}: a function of the current context</li>
 * </ul>
 * A tag with no handler at all reads its value from the context by key.
 */
public final class TagHandler {

    public enum Kind {
        STATIC,
        PRODUCER,
        CONTEXT_PRODUCER
    }

    private final Kind kind;
    private final Object value;
    private final Supplier<?> producer;
    private final Function<? super ReadableContext, ?> contextProducer;

    private TagHandler(Kind kind, Object value, Supplier<?> producer,
                       Function<? super ReadableContext, ?> contextProducer) {
        this.kind = kind;
        this.value = value;
        this.producer = producer;
        this.contextProducer = contextProducer;
    }

    /** Constant tag value. */
    public static TagHandler value(Object value) {
        if (value == null) {
            throw new InvalidTagConfigurationException("Static tag value must not be null");
        }
        return new TagHandler(Kind.STATIC, value, null, null);
    }

    /** Value produced on demand; a null result omits the tag. */
    public static TagHandler producer(Supplier<?> producer) {
        if (producer == null) {
            throw new InvalidTagConfigurationException("Tag producer must not be null");
        }
        return new TagHandler(Kind.PRODUCER, null, producer, null);
    }

    /** Value computed from the context; a null result omits the tag. */
    public static TagHandler fromContext(Function<? super ReadableContext, ?> contextProducer) {
        if (contextProducer == null) {
            throw new InvalidTagConfigurationException("Tag context producer must not be null");
        }
        return new TagHandler(Kind.CONTEXT_PRODUCER, null, null, contextProducer);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Resolves the tag value. Exceptions thrown by producers propagate unchanged.
     *
     * @param context current context (read-only)
     * @return the value, or null to omit the tag
     */
    public Object resolve(ReadableContext context) {
        return switch (kind) {
            case STATIC -> value;
            case PRODUCER -> producer.get();
            case CONTEXT_PRODUCER -> contextProducer.apply(Objects.requireNonNull(context, "context"));
        };
    }

    @Override
    public String toString() {
        return kind == Kind.STATIC ? "TagHandler[STATIC " + value + "]" : "TagHandler[" + kind + "]";
    }
}
