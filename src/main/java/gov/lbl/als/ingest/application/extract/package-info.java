/**
 * <strong>Purpose:</strong> Extraction strategies and the dispatcher that runs exactly one of them per
 * ingestion.
 * <p><strong>Pipeline role:</strong> Sits between descriptor validation and Tracker reconciliation; it is
 * the only stage that writes to the Catalog.</p>
 * <p><strong>Extension:</strong> Instrument-specific extractors implement
 * {@link gov.lbl.als.ingest.application.extract.ExtractionStrategy} and are added through
 * {@link gov.lbl.als.ingest.application.extract.ExtractionRegistry#register}.</p>
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.application.extract;
