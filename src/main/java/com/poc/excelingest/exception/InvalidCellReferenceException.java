package com.poc.excelingest.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class InvalidCellReferenceException extends DataException {

    private final String address;

    public InvalidCellReferenceException(String address, String reason) {
        super("Invalid cell reference '" + address + "': " + reason,
                ErrorCode.INVALID_CELL_REFERENCE,
                Map.of("address", String.valueOf(address), "reason", reason));
        this.address = address;
    }
}
