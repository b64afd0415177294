package com.eyelevel.documentanalyzer.repository;

import com.eyelevel.documentanalyzer.model.FinancialDocument;

import java.util.List;

/**
 * Offset based listing, which Spring Data's page-number {@code Pageable} cannot express directly.
 */
public interface FinancialDocumentSliceRepository {

    List<FinancialDocument> findSlice(int offset, int limit);
}
