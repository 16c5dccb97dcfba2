/**
 * Time sources implementing {@link gov.lbl.als.ingest.application.port.ClockPort}.
 */
package gov.lbl.als.ingest.infrastructure.time;
