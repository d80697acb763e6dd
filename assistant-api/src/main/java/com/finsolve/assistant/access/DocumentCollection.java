package com.finsolve.assistant.access;

/**
 * Department-scoped partitions of the vector index.
 */
public enum DocumentCollection {
    FINANCE("Finance", "finance"),
    MARKETING("Marketing", "marketing"),
    HR("HR", "hr_dept"),
    ENGINEERING("Engineering", "engineering"),
    GENERAL("General", "general");

    private final String department;
    private final String indexName;

    DocumentCollection(String department, String indexName) {
        this.department = department;
        this.indexName = indexName;
    }

    public String department() {
        return department;
    }

    public String indexName() {
        return indexName;
    }
}
