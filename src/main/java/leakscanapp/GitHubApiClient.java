package leakscanapp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST client using OkHttp for transport and Gson for parsing.
 * Follows {@code Link: <...>; rel="next"} pagination until exhausted.
 */
public class GitHubApiClient implements GitHubClient {
    
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>;\\s*rel=\"next\"");
    private static final String PAGE_SIZE = "100";
    
    private final HttpUrl baseUrl;
    private final String token;
    private final OkHttpClient httpClient;
    
    public GitHubApiClient(String baseUrl, String token, OkHttpClient httpClient) {
        this.baseUrl = HttpUrl.get(baseUrl);
        this.token = token;
        this.httpClient = httpClient;
    }
    
    /**
     * Create a client from GH_TOKEN_PSW and GH_API_URL
     *
     * @throws ScanPreconditionException if the token is not set
     */
    public static GitHubApiClient fromEnvironment() {
        String token = System.getenv(Shared.GITHUB_TOKEN_ENV);
        if (token == null || token.isEmpty()) {
            throw new ScanPreconditionException(Shared.GITHUB_TOKEN_ENV + " environment variable must be set to token");
        }
        String baseUrl = Shared.getEnvOrDefault(Shared.GITHUB_API_URL_ENV, Shared.DEFAULT_GITHUB_API_URL);
        return new GitHubApiClient(baseUrl, token, new OkHttpClient());
    }
    
    @Override
    public List<String> listBranches(String owner, String name) {
        return getAll("repos/" + owner + "/" + name + "/branches",
            branch -> branch.get("name").getAsString());
    }
    
    @Override
    public List<RepoRef> listUserRepositories() {
        return getAll("user/repos", this::toRepoRef);
    }
    
    @Override
    public List<RepoRef> listOrganizationRepositories(String organization) {
        return getAll("orgs/" + organization + "/repos", this::toRepoRef);
    }
    
    private RepoRef toRepoRef(JsonObject repository) {
        JsonElement sshUrl = repository.get("ssh_url");
        if (sshUrl == null || !sshUrl.isJsonPrimitive()) {
            throw new IllegalArgumentException("repository without ssh_url: " + repository.get("full_name"));
        }
        return RepoRef.fromAddress(sshUrl.getAsString());
    }
    
    /**
     * GET every page of a list endpoint and project each element
     */
    private <T> List<T> getAll(String path, Function<JsonObject, T> projection) {
        List<T> items = new ArrayList<>();
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegments(path)
            .addQueryParameter("per_page", PAGE_SIZE)
            .build();
        
        while (url != null) {
            log.debug("GET {}", url);
            Request request = new Request.Builder()
                .url(url)
                .header("Authorization", "token " + token)
                .header("Accept", "application/vnd.github+json")
                .build();
            
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new GitHubApiException(
                        "GitHub API request failed with status " + response.code() + ": /" + path,
                        path,
                        response.code()
                    );
                }
                ResponseBody body = response.body();
                JsonArray page = JsonParser.parseString(body == null ? "[]" : body.string()).getAsJsonArray();
                for (JsonElement element : page) {
                    items.add(projection.apply(element.getAsJsonObject()));
                }
                url = nextPage(response.header("Link"));
            } catch (IOException e) {
                throw new GitHubApiException("GitHub API request failed: /" + path, path, e);
            } catch (JsonParseException | IllegalStateException | IllegalArgumentException e) {
                throw new GitHubApiException("Unexpected GitHub API payload: /" + path + ": " + e.getMessage(), path, e);
            }
        }
        return items;
    }
    
    private HttpUrl nextPage(String linkHeader) {
        if (linkHeader == null) {
            return null;
        }
        Matcher matcher = NEXT_LINK.matcher(linkHeader);
        return matcher.find() ? HttpUrl.parse(matcher.group(1)) : null;
    }
}
