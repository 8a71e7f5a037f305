package com.propertyintel.epc.model;

public record CleanupResult(int certificatesDeleted, int searchesDeleted) {}
