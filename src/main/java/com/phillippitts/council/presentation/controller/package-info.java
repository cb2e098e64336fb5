/**
 * REST controllers for the council API.
 */
package com.phillippitts.council.presentation.controller;
