package gov.lbl.als.ingest.application.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ownership and access groups for a Catalog dataset.
 *
 * <p>The owner group is the proposal when one is known, otherwise the ingesting user, so that
 * someone can always see the dataset. Access groups name the beamline and the user.</p>
 *
 * @param ownerGroup group owning the dataset
 * @param accessGroups groups with read access
 * @since 0.1.0
 */
public record AccessControls(String ownerGroup, List<String> accessGroups) {
  private static final Pattern EDGE_JUNK = Pattern.compile("^[\"'\\s,]+|[\"'\\s,]+$");

  /** ALSHub and beamline controls still disagree on this beamline's name. */
  private static final String BL832_ALIAS = "bl832";
  private static final String BL832_GROUP = "8.3.2";

  public AccessControls {
    accessGroups = List.copyOf(accessGroups);
  }

  /**
   * Computes access controls.
   *
   * @param username ingesting user
   * @param beamline beamline name, may be {@code null}
   * @param proposal proposal id, may be {@code null} or the literal {@code None}
   * @return owner group and access groups
   */
  public static AccessControls calculate(String username, String beamline, String proposal) {
    String ownerGroup = username;
    if (proposal != null && !proposal.isBlank() && !"None".equals(proposal)) {
      ownerGroup = proposal;
    }
    List<String> groups = new ArrayList<>();
    if (beamline != null && !beamline.isBlank()) {
      String normalized = EDGE_JUNK.matcher(beamline.toLowerCase(Locale.ROOT)).replaceAll("");
      if (BL832_ALIAS.equals(normalized)) {
        groups.add(BL832_GROUP);
      }
      groups.add(normalized);
      if (username != null && !username.equals(normalized)) {
        groups.add(username);
      }
    }
    return new AccessControls(ownerGroup, groups);
  }
}
