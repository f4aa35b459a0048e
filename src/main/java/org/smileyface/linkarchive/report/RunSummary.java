package org.smileyface.linkarchive.report;

/**
 * Immutable counters of a finished (or cancelled) run.
 *
 * @param scraped          links fetched and committed
 * @param skippedCached    links skipped because an archived record exists
 * @param skippedCooldown  links skipped because their cooldown window is open
 * @param skippedPermanent links skipped because they are permanent failures
 * @param failed           fetch attempts that failed
 * @param newlyPermanent   failures that made their link permanent in this run; also counted in {@code failed}
 * @param parsePartial     committed records that carry parse warnings; also counted in {@code scraped}
 * @param abandoned        links never dispatched because the run was cancelled
 */
public record RunSummary(int scraped,
                         int skippedCached,
                         int skippedCooldown,
                         int skippedPermanent,
                         int failed,
                         int newlyPermanent,
                         int parsePartial,
                         int abandoned) {

    /** Links that reached a decision; equals the number of distinct links unless the run was cancelled. */
    public int total() {
        return scraped + skippedCached + skippedCooldown + skippedPermanent + failed;
    }

    @Override
    public String toString() {
        return "scraped=" + scraped
                + ", skipped_cached=" + skippedCached
                + ", skipped_cooldown=" + skippedCooldown
                + ", skipped_permanent=" + skippedPermanent
                + ", failed=" + failed
                + ", newly_permanent=" + newlyPermanent
                + ", parse_partial=" + parsePartial
                + ", abandoned=" + abandoned;
    }
}
