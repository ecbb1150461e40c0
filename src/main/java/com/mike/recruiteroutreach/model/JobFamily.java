package com.mike.recruiteroutreach.model;

import java.util.List;

/**
 * Job families with the two recruiter role terms used to search for contacts.
 */
public enum JobFamily {
    SOFTWARE_ENGINEERING("Software Engineering", "technical recruiter", "engineering recruiter"),
    DATA_SCIENCE_ML("Data Science / ML", "technical recruiter", "machine learning recruiter"),
    DATA_ANALYTICS("Data Analytics", "technical recruiter", "data recruiter"),
    BUSINESS_ANALYTICS("Business Analytics", "talent acquisition", "recruiter"),
    BUSINESS_DEVELOPMENT("Business Development / Sales", "sales recruiter", "talent acquisition"),
    PRODUCT_MANAGEMENT("Product Management", "technical recruiter", "product recruiter"),
    DESIGN_UX("Design / UX", "design recruiter", "creative recruiter"),
    DEVOPS_INFRA("DevOps / Infrastructure", "technical recruiter", "infrastructure recruiter"),
    CYBERSECURITY("Cybersecurity", "security recruiter", "technical recruiter"),
    MARKETING("Marketing", "marketing recruiter", "talent acquisition"),
    FINANCE("Finance / Accounting", "finance recruiter", "talent acquisition"),
    LEGAL("Legal / Compliance", "legal recruiter", "talent acquisition"),
    RESEARCH("Research", "research recruiter", "technical recruiter"),
    OPERATIONS("Operations", "operations recruiter", "talent acquisition"),
    POLICY("Policy / Government Affairs", "recruiter", "talent acquisition"),
    OTHER("Other", "recruiter", "talent acquisition");

    private static final List<String> FALLBACK_TERMS = List.of("recruiter", "talent acquisition");

    private final String displayName;
    private final List<String> searchTerms;

    JobFamily(String displayName, String primaryTerm, String secondaryTerm) {
        this.displayName = displayName;
        this.searchTerms = List.of(primaryTerm, secondaryTerm);
    }

    public String displayName() {
        return displayName;
    }

    public List<String> searchTerms() {
        return searchTerms;
    }

    public static List<String> searchTermsFor(JobFamily family) {
        return family == null ? FALLBACK_TERMS : family.searchTerms();
    }
}
