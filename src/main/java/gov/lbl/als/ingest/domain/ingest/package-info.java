/**
 * <strong>Purpose:</strong> Failure taxonomy and run outcome types shared by every ingestion step.
 * <p><strong>Pipeline role:</strong> Steps throw {@link gov.lbl.als.ingest.domain.ingest.IngestException};
 * the use case turns it into an {@link gov.lbl.als.ingest.domain.ingest.IngestResult}.</p>
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.domain.ingest;
