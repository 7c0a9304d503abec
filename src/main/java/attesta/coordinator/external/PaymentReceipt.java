package attesta.coordinator.external;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record PaymentReceipt(
        @JsonProperty("transactionReference") String transactionReference,
        @JsonProperty("recipient") String recipient,
        @JsonProperty("amount") BigDecimal amount) {
}
