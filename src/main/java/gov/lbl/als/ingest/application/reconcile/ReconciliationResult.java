package gov.lbl.als.ingest.application.reconcile;

import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.ingest.ReconciliationReport;

/**
 * Descriptor with its updated Tracker link, plus what reconciliation did.
 *
 * @param descriptor descriptor carrying the new Tracker link
 * @param report counts and ids of the reconciled records
 * @since 0.1.0
 */
public record ReconciliationResult(Descriptor descriptor, ReconciliationReport report) {}
