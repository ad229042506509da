/**
 * Host-to-engine translation and construction of composite requests.
 */
package com.questrail.symbolic.encode;
