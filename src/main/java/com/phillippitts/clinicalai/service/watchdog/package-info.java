/**
 * Event-driven backend health tracking.
 */
package com.phillippitts.clinicalai.service.watchdog;
