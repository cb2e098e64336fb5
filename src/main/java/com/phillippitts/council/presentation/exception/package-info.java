/**
 * Maps council exceptions to HTTP responses.
 */
package com.phillippitts.council.presentation.exception;
