package com.cbcluster.common.model;

/**
 * An enum constant with the literal the management REST API expects for it.
 */
public interface WireValue {

    String wireValue();
}
