package de.bsommerfeld.spellbook.sync.release;

/**
 * Identifies a GitHub repository for release queries.
 *
 * @param owner repository owner, a GitHub user or organization name
 * @param repo  repository name
 */
public record GitHubRepository(String owner, String repo) {

    /**
     * Parses {@code "owner/repo"} slug notation.
     *
     * @throws IllegalArgumentException if the input doesn't contain exactly
     *                                  one slash or either segment is blank
     */
    public static GitHubRepository of(String slug) {
        String[] parts = slug.split("/", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Expected 'owner/repo', got: " + slug);
        }
        return new GitHubRepository(parts[0], parts[1]);
    }

    /**
     * REST endpoint listing all releases, newest page first. The combo
     * artifact is not attached to every release, so the latest-release
     * endpoint alone is not enough.
     */
    public String releasesUrl() {
        return "https://api.github.com/repos/" + owner + "/" + repo + "/releases?per_page=100";
    }

    @Override
    public String toString() {
        return owner + "/" + repo;
    }
}
