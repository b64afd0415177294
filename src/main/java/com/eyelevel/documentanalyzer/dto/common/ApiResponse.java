package com.eyelevel.documentanalyzer.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * Technical detail for failed requests.
     */
    private final String errorDetail;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    public static <T> ApiResponse<T> success(final T data, final String displayMessage, final HttpStatus status) {
        return ApiResponse.<T>builder()
                          .response(data)
                          .displayMessage(displayMessage)
                          .showMessage(true)
                          .statusCode(status.value())
                          .build();
    }

    public static ApiResponse<Object> error(final String displayMessage) {
        return ApiResponse.builder().displayMessage(displayMessage).showMessage(true).build();
    }

    public static ApiResponse<Object> error(final String displayMessage, final String errorDetail) {
        return ApiResponse.builder().displayMessage(displayMessage).errorDetail(errorDetail).showMessage(true).build();
    }
}
