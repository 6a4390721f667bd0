package leakscanapp;

import java.util.Objects;

/**
 * A repository to scan: its clone address and the owner/name derived from it
 */
public class RepoRef {
    private String address;
    private String owner;
    private String name;
    
    public RepoRef() {
    }
    
    public RepoRef(String address, String owner, String name) {
        this.address = address;
        this.owner = owner;
        this.name = name;
    }
    
    /**
     * Parse a clone address such as {@code git@github.com:owner/name.git}.
     * The owner is the text between the first ':' and the following '/',
     * the name is the last path segment without a trailing ".git".
     * Scheme addresses ({@code https://host/owner/name.git}) take the owner after the host.
     *
     * @param address Repository address
     * @return Parsed repository reference
     */
    public static RepoRef fromAddress(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Repository address must not be null");
        }
        String trimmed = address.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Repository address has no ':' separator: " + address);
        }
        String path = trimmed.substring(colon + 1);
        if (path.startsWith("//")) {
            // scheme form, e.g. https://github.com/owner/name.git: drop the host
            int hostEnd = path.indexOf('/', 2);
            path = hostEnd < 0 ? "" : path.substring(hostEnd + 1);
        }
        int slash = path.indexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("Repository address has no owner segment: " + address);
        }
        String owner = path.substring(0, slash);
        String name = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        if (name.endsWith(".git")) {
            name = name.substring(0, name.length() - ".git".length());
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Repository address has no name segment: " + address);
        }
        return new RepoRef(trimmed, owner, name);
    }
    
    /**
     * @return "owner/name"
     */
    public String fullName() {
        return owner + "/" + name;
    }
    
    /**
     * Key under which the scan result of one branch is recorded
     *
     * @param branch Branch name
     * @return "owner/name:branch"
     */
    public String scanKey(String branch) {
        return fullName() + ":" + branch;
    }
    
    // Getters and Setters
    public String getAddress() {
        return address;
    }
    
    public void setAddress(String address) {
        this.address = address;
    }
    
    public String getOwner() {
        return owner;
    }
    
    public void setOwner(String owner) {
        this.owner = owner;
    }
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RepoRef)) return false;
        RepoRef other = (RepoRef) o;
        return Objects.equals(address, other.address)
            && Objects.equals(owner, other.owner)
            && Objects.equals(name, other.name);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(address, owner, name);
    }
    
    @Override
    public String toString() {
        return fullName();
    }
}
