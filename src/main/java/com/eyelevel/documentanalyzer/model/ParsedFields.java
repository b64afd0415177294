package com.eyelevel.documentanalyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The structured candidate fields pulled out of a document's text. Each field is either
 * {@code null} or a non-empty trimmed string.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedFields {

    @Column(name = "parsed_vendor")
    private String vendor;

    @Column(name = "parsed_invoice_no")
    private String invoiceNo;

    @Column(name = "parsed_date")
    private String invoiceDate;

    @Column(name = "parsed_total")
    private String total;

    public static ParsedFields empty() {
        return new ParsedFields();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return vendor == null && invoiceNo == null && invoiceDate == null && total == null;
    }
}
