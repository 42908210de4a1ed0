package id.go.kemenkeu.djpbn.sakti.zk.core.migration;

/**
 * Arguments a migration run was started with
 */
public class MigrationOptions {

    public static final String DEFAULT_DATABASE = "default";

    private String target;
    private boolean fake;
    private boolean fakeInitial;
    private String database = DEFAULT_DATABASE;

    public static MigrationOptions defaults() {
        return new MigrationOptions();
    }

    /**
     * True when nothing but the default database was asked for
     */
    public boolean isLaunchedWithDefaults() {
        return (target == null || target.isEmpty())
            && !fake
            && !fakeInitial
            && DEFAULT_DATABASE.equals(database);
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }
    public boolean isFake() { return fake; }
    public void setFake(boolean fake) { this.fake = fake; }
    public boolean isFakeInitial() { return fakeInitial; }
    public void setFakeInitial(boolean fakeInitial) { this.fakeInitial = fakeInitial; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }

    @Override
    public String toString() {
        return "MigrationOptions{target=" + target + ", fake=" + fake
            + ", fakeInitial=" + fakeInitial + ", database=" + database + "}";
    }
}
