package com.edushield.access;

import java.util.EnumSet;
import java.util.List;

/**
 * Resource identifiers and the fixed descriptor table of the institution's record systems.
 */
public final class InstitutionResources {

    public static final String PERSONS = "persons";
    public static final String FINANCIAL_INFORMATION = "financial_information";
    public static final String GRADES = "grades";
    public static final String CLASSES = "classes";
    public static final String DOCUMENTS = "documents";

    /** Source system for student-information records. */
    public static final String SIS_ORIGIN = "MockSIS";

    /** Source system for the document index. */
    public static final String DOCUMENT_ORIGIN = "EduShield_RAG";

    private InstitutionResources() {
        // constants only
    }

    /**
     * The descriptor table the registry is built from at process start.
     */
    public static List<ResourceDescriptor> descriptors() {
        EnumSet<Role> everyone = EnumSet.of(Role.ADMIN, Role.TEACHER, Role.STUDENT);
        return List.of(
                new ResourceDescriptor(PERSONS, SIS_ORIGIN, "FERPA", 300, everyone,
                        ResourceCategory.PERSON,
                        List.of("person_id", "name", "role", "email", "ssn",
                                "major", "year", "department", "title"),
                        null),
                new ResourceDescriptor(FINANCIAL_INFORMATION, SIS_ORIGIN, "FERPA-Financial", 120, everyone,
                        ResourceCategory.FINANCIAL,
                        List.of("person_id", "type", "amount_due", "amount_paid", "balance",
                                "scholarship", "annual_salary", "pay_frequency", "benefits", "status"),
                        "person_id"),
                new ResourceDescriptor(GRADES, SIS_ORIGIN, "FERPA", 300, EnumSet.of(Role.ADMIN, Role.TEACHER),
                        ResourceCategory.ACADEMIC,
                        List.of("student_id", "class_id", "midterm", "final", "grade", "attendance_rate"),
                        null),
                new ResourceDescriptor(CLASSES, SIS_ORIGIN, "Institutional", 600, everyone,
                        ResourceCategory.INSTITUTIONAL,
                        List.of("class_id", "name", "teacher_name", "schedule", "room",
                                "credits", "enrolled_students"),
                        null),
                new ResourceDescriptor(DOCUMENTS, DOCUMENT_ORIGIN, "Internal", 300, everyone,
                        ResourceCategory.DOCUMENT,
                        List.of("document_id", "title", "source", "content"),
                        null)
        );
    }
}
