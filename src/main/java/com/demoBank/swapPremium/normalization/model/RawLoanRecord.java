package com.demoBank.swapPremium.normalization.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Disclosure (ESIS) record as delivered by the ingestion collaborator.
 *
 * Every value is the raw text of the source cell; nothing is parsed here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawLoanRecord {

    /**
     * Source row id, used for de-duplication when present.
     */
    @JsonProperty("id")
    private String id;

    @JsonProperty("Provider")
    private String provider;

    /**
     * Parent lender name; preferred over {@link #provider} when present.
     */
    @JsonProperty("BaseLender")
    private String baseLender;

    @JsonProperty("DocumentDate")
    private String documentDate;

    /**
     * Fallback for {@link #documentDate}.
     */
    @JsonProperty("Timestamp")
    private String timestamp;

    @JsonProperty("Rate")
    private String rate;

    @JsonProperty("InitialRate")
    private String initialRate;

    @JsonProperty("Loan")
    private String loan;

    @JsonProperty("LTV")
    private String ltv;

    @JsonProperty("Loan_To_Value")
    @JsonAlias({"Loan-to-Value", "loan_to_value"})
    private String loanToValue;

    @JsonProperty("ProductType")
    private String productType;

    @JsonProperty("Mortgage_Type")
    private String mortgageType;

    @JsonProperty("PurchaseType")
    private String purchaseType;

    /**
     * Committed term: months ("24") or free text ("2 years", "5yr fixed").
     */
    @JsonProperty("TieInPeriod")
    private String tieInPeriod;

    @JsonProperty("First_Time_Buyer")
    private String firstTimeBuyer;

    @JsonProperty("Second_Time_Buyer")
    private String homeMover;

    @JsonProperty("Remortgages")
    private String remortgage;

    @JsonProperty("Description")
    @JsonAlias("Product_Description")
    private String description;
}
