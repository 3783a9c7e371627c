package com.e2eq.schemas.generator;

import com.e2eq.schemas.core.Datatype;
import com.e2eq.schemas.core.PropertyDefinition;
import com.e2eq.schemas.core.SchemaStore;
import com.e2eq.schemas.core.SchemaStore.PropertyType;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Maps a resolved property to a form input definition such as
 * {@code input type=combobox|values from category=Person|autocomplete=on|mandatory=true}.
 * <p>
 * Priority: enumerated values, then Page references, then multi-value, then the datatype table.
 * </p>
 */
public class PropertyInputMapper {

    public static final String TEXT = "text";
    public static final String NUMBER = "number";
    public static final String DATEPICKER = "datepicker";
    public static final String CHECKBOX = "checkbox";
    public static final String TEXTAREA = "textarea";
    public static final String COMBOBOX = "combobox";
    public static final String DROPDOWN = "dropdown";
    public static final String TOKENS = "tokens";

    public static final String LIST_DELIMITER = ",";

    private static final Map<Datatype, String> BY_DATATYPE = new EnumMap<>(Datatype.class);
    static {
        BY_DATATYPE.put(Datatype.TEXT, TEXT);
        BY_DATATYPE.put(Datatype.URL, TEXT);
        BY_DATATYPE.put(Datatype.EMAIL, TEXT);
        BY_DATATYPE.put(Datatype.TELEPHONE_NUMBER, TEXT);
        BY_DATATYPE.put(Datatype.NUMBER, NUMBER);
        BY_DATATYPE.put(Datatype.QUANTITY, TEXT);
        BY_DATATYPE.put(Datatype.TEMPERATURE, NUMBER);
        BY_DATATYPE.put(Datatype.DATE, DATEPICKER);
        BY_DATATYPE.put(Datatype.BOOLEAN, CHECKBOX);
        BY_DATATYPE.put(Datatype.CODE, TEXTAREA);
        BY_DATATYPE.put(Datatype.GEOGRAPHIC_COORDINATE, TEXT);
        BY_DATATYPE.put(Datatype.PAGE, COMBOBOX);
    }

    private static final Set<Datatype> TEXT_LIKE =
            EnumSet.of(Datatype.TEXT, Datatype.EMAIL, Datatype.URL, Datatype.TELEPHONE_NUMBER);

    private final SchemaStore store;

    public PropertyInputMapper(SchemaStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public String inputType(PropertyDefinition property) {
        Optional<PropertyType> type = store.propertyOf(property.name());
        if (type.map(t -> !t.allowedValues().isEmpty()).orElse(false)) {
            return DROPDOWN;
        }
        if (property.datatype() == Datatype.PAGE) {
            return property.multiValue() ? TOKENS : COMBOBOX;
        }
        if (property.multiValue()) {
            return TOKENS;
        }
        return BY_DATATYPE.getOrDefault(property.datatype(), TEXT);
    }

    /**
     * Input parameters other than {@code mandatory}, in emission order.
     */
    public Map<String, String> inputParameters(PropertyDefinition property) {
        Map<String, String> params = new LinkedHashMap<>();
        Datatype datatype = property.datatype();
        Optional<PropertyType> type = store.propertyOf(property.name());

        if (TEXT_LIKE.contains(datatype) && !property.multiValue()) {
            params.put("size", "60");
        }
        if (datatype == Datatype.CODE) {
            params.put("rows", "10");
            params.put("cols", "80");
        }

        List<String> allowed = type.map(PropertyType::allowedValues).orElse(List.of());
        Optional<String> range = type.flatMap(PropertyType::rangeCategory);
        if (!allowed.isEmpty()) {
            params.put("values", allowed.stream().map(String::trim).collect(Collectors.joining(",")));
        } else if (datatype == Datatype.PAGE && range.isPresent()) {
            params.put("values from category", range.get());
            params.put("autocomplete", "on");
        }

        if (property.multiValue()) {
            params.put("delimiter", LIST_DELIMITER);
        }
        return params;
    }

    public String inputDefinition(PropertyDefinition property) {
        Map<String, String> params = inputParameters(property);
        if (property.required()) {
            params.put("mandatory", "true");
        }
        StringBuilder sb = new StringBuilder("input type=").append(inputType(property));
        params.forEach((k, v) -> {
            if (v != null && !v.isEmpty()) {
                sb.append('|').append(k).append('=').append(v);
            }
        });
        return sb.toString();
    }
}
