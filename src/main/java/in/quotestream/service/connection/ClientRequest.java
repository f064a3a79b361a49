package in.quotestream.service.connection;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound client frame.
 *
 * <pre>
 * {"action":"subscribe","assetClass":"STOCK","symbol":"AAPL"}
 * {"action":"unsubscribe","assetClass":"STOCK","symbol":"AAPL"}
 * {"action":"ping","nonce":"42"}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ClientRequest {
    public String action;

    @JsonAlias("assetType")
    public String assetClass;

    public String symbol;
    public String nonce;
}
