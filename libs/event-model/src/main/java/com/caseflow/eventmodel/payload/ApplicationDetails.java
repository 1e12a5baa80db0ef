package com.caseflow.eventmodel.payload;

/**
 * Header data of an exemption application. An update replaces the whole record.
 *
 * @param projectId project the application belongs to
 * @param projectName project display name
 * @param applicantName name of the applicant
 * @param applicationType machine or infrastructure exemption
 * @param urgent whether the application asks for expedited handling
 * @param urgencyReason why the application is urgent, required when urgent
 * @param mitigatingMeasures measures taken to reduce emissions, nullable
 */
public record ApplicationDetails(
        String projectId,
        String projectName,
        String applicantName,
        ApplicationType applicationType,
        boolean urgent,
        String urgencyReason,
        String mitigatingMeasures)
        implements EventPayload {}
