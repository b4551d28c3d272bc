import io.dealsync.sdk.*;
import io.dealsync.sdk.model.*;

import java.util.List;

/**
 * Basic example: check the connection, then page through all deals.
 *
 * Prerequisites:
 *   - Set HUBSPOT_ACCESS_TOKEN to a private app token with crm.objects.deals.read
 */
public class DealExtractionExample {
    public static void main(String[] args) {
        // Create client from environment variables
        try (HubSpotDealsClient client = HubSpotDealsClient.fromEnv()) {
            Credential token = client.getSession().getCredential();

            // 1. Connection test
            ConnectionReport report = client.testConnection(token);
            System.out.println("Token valid: " + report.isTokenValid());
            System.out.println("Data accessible: " + report.isDataAccessible());
            report.getAccountInfo().ifPresent(info -> System.out.println("Portal: " + info.getPortalId()));
            report.getUsageInfo().flatMap(UsageSnapshot::getDailyRemaining)
                    .ifPresent(remaining -> System.out.println("Daily calls remaining: " + remaining));
            if (!report.isDataAccessible()) return;

            // 2. Walk every page of deals with their contacts
            DealPaginator pages = client.paginate(token, new DealQuery()
                    .setLimit(100)
                    .setAssociations(List.of("contacts")));
            int total = 0;
            while (pages.hasNext()) {
                for (Deal deal : pages.next().getResults()) {
                    total++;
                    System.out.println("  - " + deal.getId() + " " + deal.getPropertyAsText("dealname").orElse("(unnamed)"));
                }
            }
            System.out.println("Deals extracted: " + total + " in " + pages.getPagesFetched() + " pages");
        }
    }
}
