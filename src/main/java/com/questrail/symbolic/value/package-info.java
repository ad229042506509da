/**
 * Host-side values produced by decoding.
 */
package com.questrail.symbolic.value;
