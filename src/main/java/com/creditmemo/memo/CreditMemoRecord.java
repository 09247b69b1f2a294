package com.creditmemo.memo;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A credit memo row as normalized by the ingestion layer.
 *
 * Values are kept as recorded; amounts and dates that cannot be parsed are
 * treated as missing during validation rather than rejected here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"Memo", "Customer Name", "Cm Date", "Created By", "Amount", "Reason",
    "Date Of Approval", "Approver", "Approver Designation"})
public class CreditMemoRecord {

    /**
     * Memo identifier. Not guaranteed unique.
     */
    @JsonProperty("Memo")
    private String memo;

    @JsonProperty("Customer Name")
    private String customerName;

    /**
     * Date the credit memo was created.
     */
    @JsonProperty("Cm Date")
    private String cmDate;

    @JsonProperty("Created By")
    private String createdBy;

    @JsonProperty("Amount")
    private String amount;

    @JsonProperty("Reason")
    private String reason;

    @JsonProperty("Date Of Approval")
    private String dateOfApproval;

    @JsonProperty("Approver")
    private String approver;

    @JsonProperty("Approver Designation")
    private String approverDesignation;
}
