package com.share_link_repair.enumeration;

/**
 * Share types the repair cares about. The share table holds other values too.
 */
public enum ShareTypeEnum {

    USER(1), GROUP(2), LINK(3);

    private final int code;

    ShareTypeEnum(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
