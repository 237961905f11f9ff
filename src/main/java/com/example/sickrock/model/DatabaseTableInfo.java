package com.example.sickrock.model;

public record DatabaseTableInfo(String tableName, boolean hasConfiguration, String configurationName) {
}
