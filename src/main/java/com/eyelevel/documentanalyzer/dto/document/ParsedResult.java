package com.eyelevel.documentanalyzer.dto.document;

import com.eyelevel.documentanalyzer.model.ParsedFields;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedResult {
    private String vendor;
    private String invoiceNo;
    private String date;
    private String total;

    public static ParsedResult from(final ParsedFields fields) {
        return ParsedResult.builder()
                           .vendor(fields.getVendor())
                           .invoiceNo(fields.getInvoiceNo())
                           .date(fields.getInvoiceDate())
                           .total(fields.getTotal())
                           .build();
    }
}
