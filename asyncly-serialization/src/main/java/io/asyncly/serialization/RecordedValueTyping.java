package io.asyncly.serialization;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.TypeIdResolver;
import com.fasterxml.jackson.databind.jsontype.TypeResolverBuilder;
import com.fasterxml.jackson.databind.jsontype.impl.ClassNameIdResolver;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Default typing for recorded effect results: every value whose declared type is not
/// final carries its class name, so nested collections, records and `java.time` values
/// come back with the types they were recorded with.
///
/// Class names are only resolved when the configured {@link PolymorphicTypeValidator}
/// allows them. JDK-internal collection classes (`List.of`, `Collections.unmodifiable*`,
/// `Arrays.asList`) are written as `ArrayList`, `LinkedHashSet` or `LinkedHashMap`,
/// which keeps the allowlist to public concrete types.
///
/// @implNote Package-private. Installed by {@link RecordedValueCodec}.
final class RecordedValueTyping extends ObjectMapper.DefaultTypeResolverBuilder {

    @Serial private static final long serialVersionUID = 4471839200153046218L;

    private RecordedValueTyping(PolymorphicTypeValidator allowedTypes) {
        super(ObjectMapper.DefaultTyping.NON_FINAL, allowedTypes);
    }

    /// Typing with class-name ids written as an `@class` property, or as a wrapper array
    /// for scalar values.
    static TypeResolverBuilder<?> create(PolymorphicTypeValidator allowedTypes) {
        return new RecordedValueTyping(allowedTypes)
                .init(JsonTypeInfo.Id.CLASS, null)
                .inclusion(JsonTypeInfo.As.PROPERTY);
    }

    @Override
    protected TypeIdResolver idResolver(
            MapperConfig<?> config,
            JavaType baseType,
            PolymorphicTypeValidator subtypeValidator,
            Collection<NamedType> subtypes,
            boolean forSer,
            boolean forDeser) {
        return new PublicCollectionIdResolver(baseType, config.getTypeFactory(), subtypeValidator);
    }

    static final class PublicCollectionIdResolver extends ClassNameIdResolver {

        PublicCollectionIdResolver(
                JavaType baseType, TypeFactory typeFactory, PolymorphicTypeValidator validator) {
            super(baseType, typeFactory, validator);
        }

        @Override
        public String idFromValue(Object value) {
            return publicId(value, super.idFromValue(value));
        }

        @Override
        public String idFromValueAndType(Object value, Class<?> type) {
            return publicId(value, super.idFromValueAndType(value, type));
        }

        private static String publicId(Object value, String id) {
            if (id == null || !id.startsWith("java.util.") || id.indexOf('$') < 0) {
                return id;
            }
            if (value instanceof List<?>) {
                return ArrayList.class.getName();
            }
            if (value instanceof Set<?>) {
                return LinkedHashSet.class.getName();
            }
            if (value instanceof Map<?, ?>) {
                return LinkedHashMap.class.getName();
            }
            return id;
        }
    }
}
