package com.bbthechange.mobilelogin.validation;

import com.bbthechange.mobilelogin.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedField;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.metadata.PropertyDescriptor;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns the raw {@code data} object of an inbound event into a typed request.
 * <p>
 * Checks run in order: payload shape, JSON types of known fields, then the Bean Validation
 * constraints declared on the request class. Only the first failure is reported; when several
 * constraints fail, the field declared first wins and, within a field, a missing value is
 * reported before an empty one, an empty one before a length problem, and a length problem
 * before a format problem.
 * <p>
 * Property names, JSON names and declaration order come from Jackson's view of the request class;
 * whether a property is required comes from its Bean Validation metadata.
 */
@Component
public class RequestValidator {

    private static final Logger logger = LoggerFactory.getLogger(RequestValidator.class);

    private static final List<Class<? extends Annotation>> SEVERITY = List.of(
            NotNull.class, NotBlank.class, Size.class, Pattern.class, Email.class);

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Map<Class<?>, List<RequestProperty>> propertiesByType = new ConcurrentHashMap<>();

    public RequestValidator(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public <T> T validate(String eventName, JsonNode data, Class<T> requestType) {
        if (data == null || !data.isObject()) {
            throw new ValidationException(ValidationFailure.notAnObject(eventName, jsonType(data)));
        }

        checkJsonTypes(data, requestType);

        T request;
        try {
            request = objectMapper.treeToValue(data, requestType);
        } catch (JsonProcessingException e) {
            logger.debug("Could not bind {} payload: {}", eventName, e.getOriginalMessage());
            throw new ValidationException(new ValidationFailure(ValidationFailure.INVALID_FORMAT,
                    ValidationFailure.FORMAT_ERROR, "root", eventName + " data could not be read", Map.of()));
        }

        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            List<RequestProperty> properties = propertiesOf(requestType);
            ConstraintViolation<T> first = violations.stream()
                    .min(Comparator.<ConstraintViolation<T>>comparingInt(v -> indexOf(properties, v))
                            .thenComparingInt(RequestValidator::severity))
                    .orElseThrow();
            throw new ValidationException(toFailure(properties, first));
        }
        return request;
    }

    private void checkJsonTypes(JsonNode data, Class<?> requestType) {
        for (RequestProperty property : propertiesOf(requestType)) {
            JsonNode value = data.get(property.jsonName());
            if (value == null || value.isNull()) {
                continue;
            }
            if (property.type() == String.class && !value.isTextual()) {
                throw new ValidationException(ValidationFailure.wrongType(
                        property.jsonName(), "string", jsonType(value), property.required()));
            }
            if (Map.class.isAssignableFrom(property.type()) && !value.isObject()) {
                throw new ValidationException(ValidationFailure.wrongType(
                        property.jsonName(), "object", jsonType(value), property.required()));
            }
        }
    }

    private ValidationFailure toFailure(List<RequestProperty> properties, ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        RequestProperty property = properties.stream()
                .filter(p -> p.internalName().equals(path))
                .findFirst()
                .orElse(null);
        String name = property != null ? property.jsonName() : path;
        boolean required = property != null && property.required();
        Class<? extends Annotation> constraint = violation.getConstraintDescriptor().getAnnotation().annotationType();
        String message = violation.getMessage();

        if (constraint == NotNull.class) {
            return new ValidationFailure(ValidationFailure.MISSING_FIELD, ValidationFailure.FIELD_ERROR,
                    name, message, Map.of("required", true));
        }
        if (constraint == NotBlank.class) {
            return new ValidationFailure(ValidationFailure.EMPTY_FIELD, ValidationFailure.VALUE_ERROR,
                    name, message, Map.of("required", required));
        }
        if (constraint == Size.class) {
            Map<String, Object> attributes = violation.getConstraintDescriptor().getAttributes();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("min_length", attributes.get("min"));
            details.put("max_length", attributes.get("max"));
            Object value = violation.getInvalidValue();
            details.put("received_length", value instanceof CharSequence ? ((CharSequence) value).length() : 0);
            return new ValidationFailure(ValidationFailure.INVALID_LENGTH, ValidationFailure.LENGTH_ERROR,
                    name, message, details);
        }
        return new ValidationFailure(ValidationFailure.INVALID_FORMAT, ValidationFailure.FORMAT_ERROR,
                name, message, Map.of("required", required));
    }

    private List<RequestProperty> propertiesOf(Class<?> requestType) {
        return propertiesByType.computeIfAbsent(requestType, type -> {
            BeanDescription description = objectMapper.getDeserializationConfig()
                    .introspect(objectMapper.constructType(type));
            List<String> declared = new ArrayList<>();
            for (AnnotatedField field : description.getClassInfo().fields()) {
                declared.add(field.getName());
            }
            // Renamed properties come last from findProperties(), so restore declaration order
            List<RequestProperty> properties = new ArrayList<>();
            for (BeanPropertyDefinition definition : description.findProperties()) {
                properties.add(new RequestProperty(definition.getName(), definition.getInternalName(),
                        definition.getPrimaryType().getRawClass(), isRequired(type, definition.getInternalName())));
            }
            properties.sort(Comparator.comparingInt(p -> {
                int index = declared.indexOf(p.internalName());
                return index < 0 ? declared.size() : index;
            }));
            return List.copyOf(properties);
        });
    }

    private boolean isRequired(Class<?> requestType, String internalName) {
        PropertyDescriptor descriptor = validator.getConstraintsForClass(requestType)
                .getConstraintsForProperty(internalName);
        return descriptor != null && descriptor.getConstraintDescriptors().stream()
                .anyMatch(d -> d.getAnnotation().annotationType() == NotNull.class);
    }

    private static int severity(ConstraintViolation<?> violation) {
        int index = SEVERITY.indexOf(violation.getConstraintDescriptor().getAnnotation().annotationType());
        return index < 0 ? SEVERITY.size() : index;
    }

    private static int indexOf(List<RequestProperty> properties, ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        for (int i = 0; i < properties.size(); i++) {
            if (properties.get(i).internalName().equals(path)) {
                return i;
            }
        }
        return properties.size();
    }

    private static String jsonType(JsonNode node) {
        if (node == null) {
            return "null";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private record RequestProperty(String jsonName, String internalName, Class<?> type, boolean required) {
    }
}
