package com.ideia.contentgen.model;

/** Ownership record written to the data directory while a run is active. */
public class LockInfo {
    private long ownerPid;
    private String startedAt;
    private String model;
    private String hostname;

    public long getOwnerPid() {
        return ownerPid;
    }

    public void setOwnerPid(long ownerPid) {
        this.ownerPid = ownerPid;
    }

    public String getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(String startedAt) {
        this.startedAt = startedAt;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getHostname() {
        return hostname;
    }

    public void setHostname(String hostname) {
        this.hostname = hostname;
    }
}
