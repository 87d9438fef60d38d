/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.erasemark.exception.EraseMarkException} - Base exception</li>
 *   <li>{@link com.phillippitts.erasemark.exception.InvalidImageException} - Undecodable image or
 *       mask, or an unsupported channel layout; surfaced to the caller before any backend runs</li>
 *   <li>{@link com.phillippitts.erasemark.exception.InpaintException} - A backend attempt failed
 *       (inference error, remote job failure, timeout); triggers fallback</li>
 *   <li>{@link com.phillippitts.erasemark.exception.BackendUnavailableException} - A backend cannot
 *       run (model not loaded, no credential); triggers fallback</li>
 *   <li>{@link com.phillippitts.erasemark.exception.ModelNotFoundException} - Model file missing at
 *       load time</li>
 *   <li>{@link com.phillippitts.erasemark.exception.AllBackendsExhaustedException} - Even the
 *       classical fallback failed; the only fatal backend error</li>
 * </ul>
 *
 * @see com.phillippitts.erasemark.service.backend.InpaintBackendChain
 */
package com.phillippitts.erasemark.exception;
