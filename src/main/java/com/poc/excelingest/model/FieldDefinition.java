package com.poc.excelingest.model;

import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.exception.InvalidCellReferenceException;
import com.poc.excelingest.exception.SchemaException;
import com.poc.excelingest.util.CellAddress;
import com.poc.excelingest.util.MapProjection;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One field of a schema: where its value lives on the worksheet and what type it has.
 */
@Value
public class FieldDefinition implements MapProjection.Projectable {

    /**
     * Placeholder stored for drop-down fields that have no usable selection.
     */
    public static final String PLEASE_SELECT = "Please Select";

    String name;
    String valueAddress;
    ValueType valueType;
    boolean dropDown;
    String label;
    String labelAddress;

    @Builder
    public FieldDefinition(String name, String valueAddress, ValueType valueType, boolean dropDown,
                           String label, String labelAddress) {
        if (name == null || name.isBlank()) {
            throw new SchemaException("Field name must be a non-empty string", ErrorCode.SCHEMA_FIELD_MISSING);
        }
        if (valueType == null) {
            throw new SchemaException("Field '" + name + "' has no value type", ErrorCode.SCHEMA_FIELD_MISSING,
                    Map.of("field_name", name));
        }
        requireAddress(name, "value_address", valueAddress);
        if (labelAddress != null) {
            requireAddress(name, "label_address", labelAddress);
        }
        this.name = name;
        this.valueAddress = valueAddress;
        this.valueType = valueType;
        this.dropDown = dropDown;
        this.label = label;
        this.labelAddress = labelAddress;
    }

    private static void requireAddress(String fieldName, String property, String address) {
        try {
            CellAddress.parse(address);
        } catch (InvalidCellReferenceException e) {
            throw new SchemaException("Field '" + fieldName + "' has an invalid " + property + ": " + address,
                    ErrorCode.SCHEMA_INVALID, Map.of("field_name", fieldName, property, String.valueOf(address)), e);
        }
    }

    public CellAddress getCellAddress() {
        return CellAddress.parse(valueAddress);
    }

    /**
     * Value stored when the cell has nothing usable: the placeholder for drop-downs, an empty string otherwise.
     */
    public String defaultValue() {
        return dropDown ? PLEASE_SELECT : "";
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("value_address", valueAddress);
        map.put("value_type", valueType.getTypeName());
        map.put("is_drop_down", dropDown);
        if (label != null) {
            map.put("label", label);
        }
        if (labelAddress != null) {
            map.put("label_address", labelAddress);
        }
        return map;
    }
}
