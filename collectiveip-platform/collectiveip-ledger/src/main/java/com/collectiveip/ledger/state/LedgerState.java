package com.collectiveip.ledger.state;

/**
 * All mutable state of one ledger instance.
 * <p>
 * Subsystems reach their tables through the accessors on every call, never by caching a table
 * reference, so that {@link #restore(Snapshot)} takes effect everywhere at once.
 */
public class LedgerState {

    private OwnershipTable ownership;
    private RevenueTable revenue;
    private LicenseTable licenses;
    private GovernanceTable governance;
    private boolean paused;

    /**
     * Deep copy of every table plus the pause flag.
     */
    public record Snapshot(
            OwnershipTable ownership,
            RevenueTable revenue,
            LicenseTable licenses,
            GovernanceTable governance,
            boolean paused
    ) {}

    public LedgerState() {
        this.ownership = new OwnershipTable();
        this.revenue = new RevenueTable();
        this.licenses = new LicenseTable();
        this.governance = new GovernanceTable();
    }

    public Snapshot snapshot() {
        return new Snapshot(ownership.copy(), revenue.copy(), licenses.copy(), governance.copy(), paused);
    }

    public void restore(Snapshot snapshot) {
        this.ownership = snapshot.ownership();
        this.revenue = snapshot.revenue();
        this.licenses = snapshot.licenses();
        this.governance = snapshot.governance();
        this.paused = snapshot.paused();
    }

    public OwnershipTable ownership() { return ownership; }
    public RevenueTable revenue() { return revenue; }
    public LicenseTable licenses() { return licenses; }
    public GovernanceTable governance() { return governance; }
    public boolean isPaused() { return paused; }
    public void setPaused(boolean paused) { this.paused = paused; }
}
